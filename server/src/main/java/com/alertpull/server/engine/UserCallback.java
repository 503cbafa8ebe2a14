/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.server.engine;

import java.util.Map;

/**
 * Caller-supplied processing of one decoded record. Invoked serially, never for two
 * messages at once.
 */
@FunctionalInterface
public interface UserCallback {

    /**
     * @param record  the decoded record, after projection and metadata attachment
     * @param context the caller's context, passed through untouched
     * @return the verdict; {@code null} means acknowledge and keep the record as-is
     * @throws Exception any failure, which negatively acknowledges the message
     */
    CallbackResult process(Map<String, Object> record, Map<String, Object> context) throws Exception;
}
