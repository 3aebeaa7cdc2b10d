/*
 * Copyright © 2025 Taras Paruta (partarstu@gmail.com)
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
package org.tarik.conf.parse;

import org.tarik.conf.exceptions.ConfigFieldException.Reason;

import java.util.List;

import static org.tarik.conf.utils.CommonUtils.toDottedPath;

/**
 * A single problem found while linting a config against its spec.
 *
 * @param path    Path of the offending field.
 * @param reason  Kind of the problem.
 * @param message Description of the problem.
 */
public record LintIssue(List<String> path, Reason reason, String message) {

    public LintIssue {
        path = List.copyOf(path);
    }

    public String dottedPath() {
        return toDottedPath(path);
    }

    @Override
    public String toString() {
        return "%s at '%s': %s".formatted(reason, dottedPath(), message);
    }
}
