package me.golemcore.agent.domain.model;

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
 * Server identity and capabilities returned by the MCP {@code initialize}
 * handshake.
 */
@Data
@Builder
public class McpServerInfo {

    private String name;
    private String version;
    private String protocolVersion;
    private Map<String, Object> capabilities;

    public static McpServerInfo unknown() {
        return McpServerInfo.builder().name("Unknown").version("Unknown").capabilities(Map.of()).build();
    }
}
