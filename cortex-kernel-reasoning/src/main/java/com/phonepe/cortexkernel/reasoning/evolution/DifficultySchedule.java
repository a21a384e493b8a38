/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.cortexkernel.reasoning.evolution;

/**
 * Decides the difficulty of the next self play round. Results are capped at 1.0 by the loop.
 */
public enum DifficultySchedule {
    LINEAR {
        @Override
        public double next(double difficulty, double avgQuality) {
            return difficulty + 0.05;
        }
    },
    EXPONENTIAL {
        @Override
        public double next(double difficulty, double avgQuality) {
            return difficulty * 1.15;
        }
    },
    ADAPTIVE {
        @Override
        public double next(double difficulty, double avgQuality) {
            if (avgQuality > 0.7) {
                return difficulty + 0.08;
            }
            if (avgQuality < 0.3) {
                return Math.max(0.1, difficulty - 0.05);
            }
            return difficulty;
        }
    },
    ;

    public abstract double next(double difficulty, double avgQuality);
}
