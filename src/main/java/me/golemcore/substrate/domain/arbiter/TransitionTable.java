package me.golemcore.substrate.domain.arbiter;

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

import me.golemcore.substrate.domain.model.SystemMode;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Explicit, total table of legal mode transitions.
 *
 * <pre>
 * OBSERVE -> ALERT, DEFEND
 * ALERT   -> ACT, OBSERVE, DEFEND
 * ACT     -> OBSERVE, DEFEND
 * DEFEND  -> OBSERVE
 * </pre>
 *
 * Staying in the current mode is not a transition.
 */
public final class TransitionTable {

    private static final Map<SystemMode, Set<SystemMode>> ALLOWED = new EnumMap<>(SystemMode.class);

    static {
        ALLOWED.put(SystemMode.OBSERVE, EnumSet.of(SystemMode.ALERT, SystemMode.DEFEND));
        ALLOWED.put(SystemMode.ALERT, EnumSet.of(SystemMode.ACT, SystemMode.OBSERVE, SystemMode.DEFEND));
        ALLOWED.put(SystemMode.ACT, EnumSet.of(SystemMode.OBSERVE, SystemMode.DEFEND));
        ALLOWED.put(SystemMode.DEFEND, EnumSet.of(SystemMode.OBSERVE));
    }

    private TransitionTable() {
    }

    public static boolean isAllowed(SystemMode from, SystemMode to) {
        return ALLOWED.get(from).contains(to);
    }

    public static Set<SystemMode> reachableFrom(SystemMode from) {
        return EnumSet.copyOf(ALLOWED.get(from));
    }
}
