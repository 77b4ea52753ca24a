package com.example.studentvoice.db;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.init.DatabasePopulatorUtils;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;

/**
 * Применяет {@code db/schema.sql} при старте. Все DDL-команды написаны с
 * {@code IF NOT EXISTS}, поэтому повторный запуск ничего не меняет.
 * Ошибка хранилища (права, диск) пробрасывается как {@code ScriptException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SchemaInitializer {

    private final DataSource dataSource;

    @Value("${app.data.schema:db/schema.sql}")
    private String schemaLocation;

    @PostConstruct
    public void init() {
        initializeSchema();
    }

    public void initializeSchema() {
        log.info("Применение схемы БД из {}", schemaLocation);
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource(schemaLocation));
        populator.setSqlScriptEncoding("UTF-8");
        populator.setContinueOnError(false);
        DatabasePopulatorUtils.execute(populator, dataSource);
        log.info("Схема БД применена");
    }
}
