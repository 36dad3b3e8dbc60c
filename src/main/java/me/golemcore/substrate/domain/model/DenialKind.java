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
 * Why the Arbiter denied a mode-change request.
 */
public enum DenialKind {
    /** The target is not reachable from the current mode. */
    INVALID_TRANSITION,
    /** The requester lacks the privilege required for the target mode. */
    INSUFFICIENT_PRIVILEGE,
    /** Too many transitions in the trailing window. */
    THRASH_LIMIT
}
