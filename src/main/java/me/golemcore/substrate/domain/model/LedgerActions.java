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
 * Action kinds written by the kernel itself. Agent actions use the kinds of the
 * configured cost table and are recorded under {@link #ACTION_INTENT} and
 * {@link #ACTION_OUTCOME}.
 */
public final class LedgerActions {

    public static final String AGENT_REGISTERED = "agent.registered";
    public static final String ADMISSION_REJECTED = "admission.rejected";
    public static final String ACCESS_DENIED = "access.denied";

    public static final String ACTION_INTENT = "action.intent";
    public static final String ACTION_OUTCOME = "action.outcome";

    public static final String BUDGET_ALLOCATED = "budget.allocated";
    public static final String BUDGET_DEBIT = "budget.debit";

    public static final String MODE_REQUESTED = "arbiter.mode.requested";
    public static final String MODE_RESOLVED = "arbiter.mode.resolved";
    public static final String CONFLICT_RESOLVED = "arbiter.conflict.resolved";

    public static final String AGENT_QUARANTINED = "guardian.quarantine";
    public static final String AGENT_RELEASED = "guardian.release";
    public static final String AGENT_TERMINATED = "guardian.terminate";
    public static final String CHECKPOINT_CREATED = "guardian.checkpoint";
    public static final String ROLLBACK = "guardian.rollback";
    public static final String REVIEW_FLAGGED = "guardian.review.flagged";
    public static final String REVIEW_RESOLVED = "guardian.review.resolved";

    private LedgerActions() {
    }
}
