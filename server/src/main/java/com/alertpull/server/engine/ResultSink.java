/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.server.engine;

import java.util.Map;

/**
 * Receives each counted result as the driver records it, whether or not the run
 * collects results.
 */
@FunctionalInterface
public interface ResultSink {

    void accept(Map<String, Object> result);
}
