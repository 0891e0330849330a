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
 * Result of a single resolved tool invocation.
 *
 * @param toolCallId
 *            id of the paired {@link ToolCallRecord}
 * @param toolName
 *            tool name, used to pick a per-tool truncation override
 * @param output
 *            raw tool output, serialized and truncated when written to history
 * @param error
 *            whether the engine reported the invocation as failed
 */
public record ToolResultRecord(String toolCallId,String toolName,Object output,boolean error){}
