/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.statespace.store;

/**
 * The handle returned when an observer is registered with a store. Calling
 * {@link #unsubscribe()} stops further notifications; calling it more than once
 * has no additional effect.
 */
public class Subscription {

    private final Runnable onUnsubscribe;

    private boolean active = true;

    Subscription(Runnable onUnsubscribe) {
        this.onUnsubscribe = onUnsubscribe;
    }

    public void unsubscribe() {
        if (active) {
            active = false;
            onUnsubscribe.run();
        }
    }

    public boolean isActive() {
        return active;
    }
}
