package me.golemcore.substrate.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Snapshot of the system's operational mode.
 */
@Value
@Builder(toBuilder = true)
public class ModeState {

    SystemMode mode;
    Instant enteredAt;

    /** Approved transitions inside the current anti-thrash window. */
    int transitionsInWindow;

    /** Ledger entry that put the system into {@link #mode}; 0 for the boot state. */
    long ledgerSequence;

    public static ModeState initial(Instant now) {
        return ModeState.builder().mode(SystemMode.OBSERVE).enteredAt(now).transitionsInWindow(0).build();
    }
}
