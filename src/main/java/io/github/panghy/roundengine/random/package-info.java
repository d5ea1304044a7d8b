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
 * Seeded random sources.
 *
 * <p>{@link io.github.panghy.roundengine.random.DeterministicRandomSource} is a
 * Mulberry32 generator whose output sequence is fixed by its 32-bit seed, so a
 * session can be replayed from the hex seed shown to the player.</p>
 */
package io.github.panghy.roundengine.random;
