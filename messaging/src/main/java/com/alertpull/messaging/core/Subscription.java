/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.messaging.core;

/**
 * A named subscription and the topic it is bound to. {@code topic} is {@code null}
 * when the broker cannot report the binding of an existing subscription.
 */
public record Subscription(String name, String path, String topic) {}
