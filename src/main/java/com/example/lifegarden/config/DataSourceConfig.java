package com.example.lifegarden.config;

import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Slf4j
@Configuration
public class DataSourceConfig {
  private static final String SQLITE_PREFIX = "jdbc:sqlite:";

  @Bean
  @Primary
  public DataSource dataSource(@Value("${spring.datasource.url}") String url,
                               @Value("${spring.datasource.driver-class-name}") String driver) {
    ensureSqliteDir(url);
    HikariDataSource ds = new HikariDataSource();
    ds.setJdbcUrl(url);
    ds.setDriverClassName(driver);
    if (url.startsWith(SQLITE_PREFIX)) {
      // SQLite allows a single writer; one connection keeps watering batches strictly serial
      ds.setMaximumPoolSize(1);
    }
    return ds;
  }

  private void ensureSqliteDir(String url) {
    if (url == null || !url.startsWith(SQLITE_PREFIX)) {
      return;
    }
    String path = url.substring(SQLITE_PREFIX.length());
    if (path.isBlank() || path.startsWith(":memory:") || path.startsWith("file:")) {
      return;
    }
    if (path.startsWith("./")) {
      path = path.substring(2);
    }
    Path dbPath = Path.of(path).toAbsolutePath();
    Path parent = dbPath.getParent();
    if (parent == null) {
      return;
    }
    try {
      Files.createDirectories(parent);
    } catch (IOException ex) {
      throw new IllegalStateException("Cannot create garden database directory " + parent, ex);
    }
    log.info("Garden database file: {}", dbPath);
  }
}
