/*
 * Copyright 2025 Aristo
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
package ru.nts.tools.pbip.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.tools.pbip.core.PbipErrorCode;
import ru.nts.tools.pbip.core.PbipException;

import java.nio.file.Path;

/**
 * Инструмент, вызываемый внешним диспетчером (например, MCP-сервером) по имени
 * с параметрами в JSON. Диспетчер в этот проект не входит.
 */
public interface McpTool {

    String getName();

    String getDescription();

    JsonNode getInputSchema();

    JsonNode execute(JsonNode params) throws Exception;

    /**
     * Обертка над execute: любые ошибки превращаются в структурированный ответ с {@code isError=true}.
     */
    default JsonNode executeWithFeedback(JsonNode params) {
        Logger log = LoggerFactory.getLogger(getClass());
        try {
            return execute(params);
        } catch (PbipException e) {
            log.warn("{} failed: {}", getName(), e.toLogMessage());
            return createErrorResponse(e);
        } catch (IllegalArgumentException e) {
            return createErrorResponse(new PbipException(PbipErrorCode.INVALID_REQUEST, "reason", e.getMessage()));
        } catch (SecurityException e) {
            return createErrorResponse(new PbipException(PbipErrorCode.FILE_NOT_READABLE, "reason", e.getMessage()));
        } catch (Exception e) {
            log.error("{} failed unexpectedly", getName(), e);
            return createErrorResponse(new PbipException(PbipErrorCode.INTERNAL_ERROR, "reason", e.toString()));
        }
    }

    private static JsonNode createErrorResponse(PbipException e) {
        ObjectNode res = new ObjectMapper().createObjectNode();
        res.putArray("content").addObject().put("type", "text").put("text", e.toUserMessage());
        res.put("isError", true);
        ObjectNode error = res.putObject("error");
        error.put("code", e.getCode().name());
        error.put("message", e.getCode().getMessage());
        error.put("solution", e.getCode().resolveSolution(e.getContext()));
        ArrayNode files = error.putArray("files");
        for (Path file : e.getFiles()) {
            files.add(file.toString());
        }
        ArrayNode identifiers = error.putArray("identifiers");
        e.getIdentifiers().forEach(identifiers::add);
        ArrayNode suggestions = error.putArray("suggestions");
        e.getSuggestions().forEach(suggestions::add);
        return res;
    }
}
