package com.apisite.checker.config;

import com.apisite.checker.cli.ConfirmationPrompt;
import com.apisite.checker.cli.ConsoleConfirmationPrompt;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class CheckerConfig {

    @Bean(name = "probeExecutor", destroyMethod = "shutdown")
    public ExecutorService probeExecutor(CheckerProperties properties) {
        return Executors.newFixedThreadPool(properties.getWorkerConcurrency());
    }

    @Bean(name = "reportStream", destroyMethod = "")
    public PrintStream reportStream() {
        return new PrintStream(System.out, true, StandardCharsets.UTF_8);
    }

    @Bean
    public ConfirmationPrompt confirmationPrompt(
        CheckerProperties properties,
        @Qualifier("reportStream") PrintStream reportStream
    ) {
        BufferedReader input = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        return new ConsoleConfirmationPrompt(input, reportStream, properties.getCli().isAssumeYes());
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
