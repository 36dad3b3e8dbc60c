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
import me.golemcore.substrate.domain.exception.ArbitrationDeniedException;
import me.golemcore.substrate.domain.exception.InvalidTransitionException;

import java.time.Instant;

/**
 * A request to change the operational mode. Created pending, resolved exactly
 * once, then kept as history. Retrying means filing a new request.
 */
@Value
@Builder(toBuilder = true)
public class ModeChangeRequest {

    String id;
    String requesterId;
    Privilege requesterPrivilege;
    SystemMode fromMode;
    SystemMode targetMode;
    String justification;
    Instant submittedAt;

    /** Ledger entry that recorded the submission. */
    long requestLedgerSequence;

    @Builder.Default
    RequestResolution resolution = RequestResolution.PENDING;
    DenialKind denialKind;
    String reason;
    String resolverId;
    Instant resolvedAt;

    /** Ledger entry that recorded the resolution. */
    long resolutionLedgerSequence;

    public boolean isApproved() {
        return resolution == RequestResolution.APPROVED;
    }

    public boolean isPending() {
        return resolution == RequestResolution.PENDING;
    }

    public ModeChangeRequest approve(String resolverId, Instant at, long ledgerSequence) {
        return resolve(RequestResolution.APPROVED, null, "approved", resolverId, at, ledgerSequence);
    }

    public ModeChangeRequest deny(DenialKind kind, String reason, String resolverId, Instant at,
            long ledgerSequence) {
        return resolve(RequestResolution.DENIED, kind, reason, resolverId, at, ledgerSequence);
    }

    private ModeChangeRequest resolve(RequestResolution outcome, DenialKind kind, String why, String resolver,
            Instant at, long ledgerSequence) {
        if (!isPending()) {
            throw new IllegalStateException("Mode change request " + id + " is already " + resolution);
        }
        return toBuilder()
                .resolution(outcome)
                .denialKind(kind)
                .reason(why)
                .resolverId(resolver)
                .resolvedAt(at)
                .resolutionLedgerSequence(ledgerSequence)
                .build();
    }

    /**
     * Returns this request when approved, otherwise raises the exception matching
     * the denial kind.
     */
    public ModeChangeRequest orThrow() {
        if (isApproved()) {
            return this;
        }
        if (denialKind == DenialKind.INVALID_TRANSITION) {
            throw new InvalidTransitionException(reason, resolutionLedgerSequence);
        }
        throw new ArbitrationDeniedException(reason, resolutionLedgerSequence);
    }
}
