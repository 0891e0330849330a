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
 * Tool invocation that has started but not yet finished.
 *
 * @param runId
 *            engine run identifier used to match the end event
 * @param toolName
 *            tool name from the start event
 * @param args
 *            tool arguments from the start event
 * @param suppliedId
 *            caller-assigned tool call id, may be null
 * @param sequence
 *            start arrival order within the run
 */
public record PendingInvocation(String runId,String toolName,Object args,String suppliedId,long sequence){}
