package me.golemcore.transcript.domain.model;

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
 * Strategy used to bound the size of stored tool output.
 */
public enum TruncationMethod {

    /**
     * Keep the head of the content and append a marker.
     */
    END,

    /**
     * Keep head and tail of the content around a marker.
     */
    MIDDLE,

    /**
     * Pick a strategy from the content shape (JSON, XML, line-oriented text).
     */
    SMART,

    /**
     * Keep JSON parseable by dropping trailing array elements or object fields.
     */
    STRUCTURED
}
