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

/**
 * Capability level held by a caller. Levels are ordered: a caller satisfies a
 * requirement when its rank is at least the required rank.
 */
public enum Privilege {
    AGENT(0), AUDITOR(1), OPERATOR(2), ARCHITECT(3);

    private final int rank;

    Privilege(int rank) {
        this.rank = rank;
    }

    public boolean satisfies(Privilege required) {
        return required == null || rank >= required.rank;
    }

    public boolean isHuman() {
        return this != AGENT;
    }
}
