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

package com.phonepe.cortexkernel.memory;

import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Consolidated summary of short term entries removed by compression
 */
@Value
public class KnowledgeBlock {
    String id;
    List<String> sourceIds;
    String summary;
    LocalDateTime createdAt;
    /**
     * Number of entries folded into this block
     */
    int compressionRatio;
}
