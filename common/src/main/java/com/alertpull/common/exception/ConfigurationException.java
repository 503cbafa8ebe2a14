/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.common.exception;

/**
 * Invalid stop settings, bad broker configuration, or a subscription that cannot be
 * provisioned because its topic does not exist. Always fatal to the call that raised it.
 */
public class ConfigurationException extends AlertPullException {
    public ConfigurationException(String message) {
        super("APL_CONFIGURATION", message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super("APL_CONFIGURATION", message, cause);
    }
}
