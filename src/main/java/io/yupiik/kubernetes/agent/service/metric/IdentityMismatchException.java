/*
 * Copyright (c) 2024 - present - Yupiik SAS - https://www.yupiik.com
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *  http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package io.yupiik.kubernetes.agent.service.metric;

import io.yupiik.kubernetes.agent.client.model.metrics.ObjectReference;

/**
 * Two metric records about different objects were combined, it means the queries were not aligned.
 */
public class IdentityMismatchException extends Exception {
    private final ObjectReference left;
    private final ObjectReference right;

    public IdentityMismatchException(final ObjectReference left, final ObjectReference right) {
        super("Can't combine metrics of " + left + " with metrics of " + right);
        this.left = left;
        this.right = right;
    }

    public ObjectReference left() {
        return left;
    }

    public ObjectReference right() {
        return right;
    }
}
