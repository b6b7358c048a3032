/*
 * Copyright 2022 - 2025 The Original Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 *     you may not use this file except in compliance with the License.
 *     You may obtain a copy of the License at
 *
 *           http://www.apache.org/licenses/LICENSE-2.0
 *
 *     Unless required by applicable law or agreed to in writing, software
 *     distributed under the License is distributed on an "AS IS" BASIS,
 *     WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *     See the License for the specific language governing permissions and
 *     limitations under the License.
 *
 */

package org.elasticsoftware.fold;

import jakarta.inject.Inject;
import org.elasticsoftware.fold.aggregate.AggregateStateFolderFactory;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.junit.jupiter.SpringJUnitConfig;

import static org.junit.jupiter.api.Assertions.assertEquals;

@SpringJUnitConfig(FoldRuntimeConfiguration.class)
@TestPropertySource(properties = "fold.replay.log-interval=250")
public class FoldRuntimeConfigurationTests {
    @Inject
    ApplicationContext applicationContext;
    @Inject
    AggregateStateFolderFactory aggregateStateFolderFactory;

    @Test
    public void testReplayLogIntervalIsConfigured() {
        assertEquals(250, aggregateStateFolderFactory.getReplayLogInterval());
        assertEquals(1, applicationContext.getBeansOfType(AggregateStateFolderFactory.class).size());
    }
}
