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
 * Fires after {@code max-consecutive-failures} failed action outcomes in a row.
 */
@Component
public class FailureStreakRule extends StreakRule {

    public FailureStreakRule(SubstrateProperties properties) {
        super(SignalType.ACTION_FAILED, SignalType.ACTION_SUCCEEDED,
                properties.getGuardian().getMaxConsecutiveFailures());
    }

    @Override
    public String getName() {
        return "action-failure-streak";
    }

    @Override
    protected String describe(int streak, AnomalySignal last) {
        return streak + " consecutive failed actions, last: " + last.detail();
    }
}
