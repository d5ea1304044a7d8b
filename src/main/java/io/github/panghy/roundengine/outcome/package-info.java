/*
 * Copyright 2024 The RoundEngine Project Authors
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
 */

/**
 * The discrete multi-event model.
 *
 * <p>A round is resolved by {@link io.github.panghy.roundengine.outcome.OutcomeEngine}
 * from an independent rare event, a three-way weighted draw and an optional
 * second draw after a miss. All probabilities come from one
 * {@link io.github.panghy.roundengine.outcome.OutcomeTuning} table whose RTP can
 * be derived analytically.</p>
 */
package io.github.panghy.roundengine.outcome;
