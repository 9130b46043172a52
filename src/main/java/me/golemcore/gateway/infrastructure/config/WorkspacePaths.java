package me.golemcore.gateway.infrastructure.config;

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

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Resolves the workspace directory from {@code gateway.storage.base-path}.
 */
public final class WorkspacePaths {

    private static final String USER_HOME_PLACEHOLDER = "${user.home}";

    private WorkspacePaths() {
    }

    public static Path basePath(GatewayProperties properties) {
        String configured = properties.getStorage().getBasePath();
        return Paths.get(configured.replace(USER_HOME_PLACEHOLDER, System.getProperty("user.home")))
                .toAbsolutePath().normalize();
    }
}
