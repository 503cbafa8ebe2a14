/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.web;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.alertpull")
public class AlertPullApplication {
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(AlertPullApplication.class);
        app.setRegisterShutdownHook(true); // stops running pulls through StreamService.close()
        app.run(args);
    }
}
