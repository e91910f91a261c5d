package com.aec.CalendarSrv.config;

import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.http.HttpRequestInitializer;
import com.google.api.client.http.javanet.NetHttpTransport;
import com.google.api.client.json.jackson2.JacksonFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.time.Clock;

@Configuration
public class GoogleClientConfig {

    @Bean
    public NetHttpTransport googleHttpTransport() throws GeneralSecurityException, IOException {
        return GoogleNetHttpTransport.newTrustedTransport();
    }

    @Bean
    public JacksonFactory googleJsonFactory() {
        return JacksonFactory.getDefaultInstance();
    }

    /** Timeouts para toda llamada saliente a Google. */
    @Bean
    public HttpRequestInitializer googleTimeouts(GoogleCalendarProperties props) {
        int connect = (int) props.getConnectTimeout().toMillis();
        int read = (int) props.getReadTimeout().toMillis();
        return request -> {
            request.setConnectTimeout(connect);
            request.setReadTimeout(read);
        };
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
