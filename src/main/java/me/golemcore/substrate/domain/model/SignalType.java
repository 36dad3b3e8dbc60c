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

public enum SignalType {
    /** Debit rate over the velocity window exceeded the configured threshold. */
    DEBIT_VELOCITY,
    /** The Arbiter denied a mode-change request from the agent. */
    MODE_REQUEST_DENIED,
    /** The Arbiter approved a mode-change request from the agent. */
    MODE_REQUEST_APPROVED,
    /** The agent reported a failed action outcome. */
    ACTION_FAILED,
    /** The agent reported a successful action outcome. */
    ACTION_SUCCEEDED
}
