package id.go.kemenkeu.djpbn.sakti.zk.example;

import id.go.kemenkeu.djpbn.sakti.zk.core.async.ConnectionScopedThreadFactory;
import id.go.kemenkeu.djpbn.sakti.zk.core.connection.ConnectionManager;
import id.go.kemenkeu.djpbn.sakti.zk.core.migration.MigrationExecutor;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.util.concurrent.ExecutorService;

@Configuration
public class ExampleConfig {
    // in-memory H2 database standing in for the shared application database
    @Bean
    public DataSource dsMain() {
        return DataSourceBuilder.create().driverClassName("org.h2.Driver").url("jdbc:h2:mem:maindb;DB_CLOSE_DELAY=-1").username("sa").build();
    }

    @Bean
    public JdbcTemplate jdbcTemplateMain(DataSource dsMain) { return new JdbcTemplate(dsMain); }

    @Bean
    public MigrationExecutor migrationExecutor(JdbcTemplate jdbcTemplateMain) {
        return new JdbcMigrationExecutor(jdbcTemplateMain, JdbcMigrationExecutor.EXAMPLE_MIGRATIONS);
    }

    // workers keep one ZooKeeper connection each for their whole life
    @Bean(destroyMethod = "shutdown")
    public ExecutorService lockedWorkers(ConnectionManager connectionManager) {
        return ConnectionScopedThreadFactory.newFixedThreadPool(2, connectionManager);
    }
}
