package com.reelpilot.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.reelpilot.session.device.AdbShell;
import com.reelpilot.session.device.DisconnectedScreenStateProvider;
import com.reelpilot.session.device.Uiautomator2ScreenStateProvider;
import com.reelpilot.session.screen.LocatorCatalog;
import com.reelpilot.session.screen.ScreenStateProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class SessionConfig {
    private static final Logger log = LoggerFactory.getLogger(SessionConfig.class);

    @Bean(name = "sessionRunExecutor", destroyMethod = "shutdown")
    public ExecutorService sessionRunExecutor() {
        return Executors.newSingleThreadExecutor();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public LocatorCatalog locatorCatalog(SessionProperties properties) {
        return new LocatorCatalog(properties.getLocators(), properties.getLocatorAlternates());
    }

    @Bean
    public ScreenStateProvider screenStateProvider(SessionProperties properties, ObjectMapper objectMapper) {
        SessionProperties.Device device = properties.getDevice();
        if (!device.isEnabled()) {
            log.info("Device bridge disabled; workflows will fail fast on screen access");
            return new DisconnectedScreenStateProvider();
        }
        HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(device.getRequestTimeoutSeconds()))
            .build();
        AdbShell adb = new AdbShell(device.getAdbPath(), device.getSerial(), Duration.ofSeconds(device.getRequestTimeoutSeconds()));
        return new Uiautomator2ScreenStateProvider(
            httpClient,
            objectMapper,
            device.getUrl(),
            Duration.ofSeconds(device.getRequestTimeoutSeconds()),
            adb,
            device.getAppPackage()
        );
    }
}
