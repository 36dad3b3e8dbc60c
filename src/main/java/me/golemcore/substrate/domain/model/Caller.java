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

import lombok.Value;

import java.util.Objects;

/**
 * Identity and privilege of whoever invokes a kernel operation. Agents are
 * callers with {@link Privilege#AGENT}; human operators and auditors carry a
 * higher privilege and are not subject to agent admission control.
 */
@Value
public class Caller {

    public static final String SYSTEM_GUARDIAN = "system:guardian";

    String id;
    Privilege privilege;

    public Caller(String id, Privilege privilege) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("caller id is required");
        }
        this.id = id;
        this.privilege = Objects.requireNonNull(privilege, "privilege must not be null");
    }

    public static Caller agent(String id) {
        return new Caller(id, Privilege.AGENT);
    }

    public static Caller operator(String id) {
        return new Caller(id, Privilege.OPERATOR);
    }

    public static Caller auditor(String id) {
        return new Caller(id, Privilege.AUDITOR);
    }

    public boolean isAgent() {
        return privilege == Privilege.AGENT;
    }

    public boolean holds(Privilege required) {
        return privilege.satisfies(required);
    }
}
