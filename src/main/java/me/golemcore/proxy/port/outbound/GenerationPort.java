package me.golemcore.proxy.port.outbound;

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

import me.golemcore.proxy.domain.model.GenerationRequest;
import me.golemcore.proxy.domain.model.GenerationResult;

/**
 * Port for the upstream generation provider. Blocking; bounded by the
 * provider's own call timeout.
 */
public interface GenerationPort {

    /**
     * Run one generation.
     *
     * @throws me.golemcore.proxy.domain.model.GenerationException
     *             when the provider answered with an error status
     * @throws me.golemcore.proxy.domain.model.GenerationTimeoutException
     *             when the call timed out
     */
    GenerationResult generate(GenerationRequest request);
}
