package me.golemcore.gateway.adapter.outbound.attachment;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.AttachmentSegment;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.AttachmentResolverPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Resolves {@code file:} attachments (absolute URIs or paths relative to the
 * project directory) into inline text. Binary files, files over the size
 * limit and other URI schemes are skipped with a warning.
 */
@Component
@Slf4j
public class FileAttachmentResolver implements AttachmentResolverPort {

    private static final String FILE_SCHEME = "file";

    private final GatewayProperties properties;

    public FileAttachmentResolver(GatewayProperties properties) {
        this.properties = properties;
    }

    @Override
    public List<AttachmentSegment> resolve(List<AttachmentSegment> attachments) {
        List<AttachmentSegment> resolved = new ArrayList<>();
        for (AttachmentSegment attachment : attachments) {
            if (attachment.isResolved()) {
                resolved.add(attachment);
                continue;
            }
            Path path = toPath(attachment.uri());
            if (path == null) {
                log.warn("[Context] Unsupported attachment URI: {}", attachment.uri());
                continue;
            }
            String text = readText(path);
            if (text != null) {
                String name = attachment.name() != null ? attachment.name() : path.getFileName().toString();
                String mediaType = attachment.mediaType() != null ? attachment.mediaType() : "text/plain";
                resolved.add(new AttachmentSegment(attachment.uri(), mediaType, name, text));
            }
        }
        return resolved;
    }

    private Path toPath(String uri) {
        Path projectDir = Path.of(properties.getContext().getProjectDir()).toAbsolutePath().normalize();
        if (uri.startsWith(FILE_SCHEME + ":")) {
            try {
                return Path.of(URI.create(uri)).normalize();
            } catch (IllegalArgumentException e) {
                log.warn("[Context] Malformed file URI {}: {}", uri, e.getMessage());
                return null;
            }
        }
        if (uri.contains("://")) {
            return null;
        }
        return projectDir.resolve(uri).normalize();
    }

    private String readText(Path path) {
        if (!Files.isRegularFile(path)) {
            log.warn("[Context] Attachment not found: {}", path);
            return null;
        }
        long limit = properties.getContext().getMaxAttachmentBytes();
        try {
            long size = Files.size(path);
            if (size > limit) {
                log.warn("[Context] Attachment {} is {} bytes, limit is {}", path, size, limit);
                return null;
            }
            byte[] bytes = Files.readAllBytes(path);
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            log.warn("[Context] Attachment {} is not UTF-8 text, skipped", path);
            return null;
        } catch (IOException e) {
            log.warn("[Context] Failed to read attachment {}: {}", path, e.getMessage());
            return null;
        }
    }
}
