package me.golemcore.substrate.domain.guardian;

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

import me.golemcore.substrate.domain.model.AnomalySignal;
import me.golemcore.substrate.domain.model.SignalType;
import me.golemcore.substrate.infrastructure.config.SubstrateProperties;
import org.springframework.stereotype.Component;

/**
 * Fires after {@code max-consecutive-denials} denied mode requests in a row.
 */
@Component
public class DenialStreakRule extends StreakRule {

    public DenialStreakRule(SubstrateProperties properties) {
        super(SignalType.MODE_REQUEST_DENIED, SignalType.MODE_REQUEST_APPROVED,
                properties.getGuardian().getMaxConsecutiveDenials());
    }

    @Override
    public String getName() {
        return "mode-denial-streak";
    }

    @Override
    protected String describe(int streak, AnomalySignal last) {
        return streak + " consecutive mode requests denied, last: " + last.detail();
    }
}
