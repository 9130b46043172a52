package me.golemcore.gateway.port.outbound;

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

import me.golemcore.gateway.domain.model.AttachmentSegment;

import java.util.List;

/**
 * Resolves attachment references into inline content.
 */
public interface AttachmentResolverPort {

    /**
     * Returns resolved copies of {@code attachments}, in the same order.
     * Attachments that cannot be read are left out.
     */
    List<AttachmentSegment> resolve(List<AttachmentSegment> attachments);
}
