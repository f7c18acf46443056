package me.wargame.mcp.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Defines a tool that an agent can call. Contains the tool name, description,
 * the data source it reads, and the JSON Schema of its input parameters.
 */
@Data
@Builder
public class ToolDefinition {

    public static final String VERSION = "v1";

    private String name;
    private String description;
    private ToolSource source;
    private Map<String, Object> inputSchema; // JSON Schema

    @Builder.Default
    private String version = VERSION;
}
