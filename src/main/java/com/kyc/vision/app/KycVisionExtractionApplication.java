package com.kyc.vision.app;

import com.kyc.vision.app.config.ExtractionProperties;
import com.kyc.vision.app.config.GroupingProperties;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Entry point for the KYC Vision Extraction service.
 *
 * <p>The service sends scanned identity and supporting documents to a vision-capable language
 * model page by page and assembles the page results into logical documents. Usage:
 *
 * <pre>
 *   mvn spring-boot:run
 * </pre>
 */
@Log4j2
@SpringBootApplication
@EnableConfigurationProperties({ExtractionProperties.class, GroupingProperties.class})
public class KycVisionExtractionApplication {

  public static void main(String[] args) {
    log.info("Starting KYC Vision Extraction application...");
    SpringApplication.run(KycVisionExtractionApplication.class, args);
    log.info("KYC Vision Extraction application started successfully.");
  }
}
