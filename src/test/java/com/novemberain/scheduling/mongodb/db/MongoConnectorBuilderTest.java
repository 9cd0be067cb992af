package com.novemberain.scheduling.mongodb.db;

import com.mongodb.client.MongoDatabase;
import com.novemberain.scheduling.SchedulerConfigException;
import org.junit.Test;

import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.Mockito.mock;

public class MongoConnectorBuilderTest {

    @Test
    public void givenConnectorIsUsedAsIs() throws Exception {
        MongoConnector connector = mock(MongoConnector.class);

        assertSame(connector, MongoConnectorBuilder.builder().withConnector(connector).build());
    }

    @Test
    public void connectorExcludesOtherSources() {
        expectConfigError(MongoConnectorBuilder.builder()
                .withConnector(mock(MongoConnector.class))
                .withDatabaseName("scheduler"), "'Database name' parameter is not allowed");
    }

    @Test
    public void databaseExcludesConnectionOptions() {
        expectConfigError(MongoConnectorBuilder.builder()
                .withWriteConcernWriteTimeout(5000)
                .withDatabase(mock(MongoDatabase.class))
                .withMaxConnections(10), "'Max connections' parameter is not allowed");
    }

    @Test
    public void uriExcludesAddresses() {
        expectConfigError(MongoConnectorBuilder.builder()
                .withWriteConcernWriteTimeout(5000)
                .withUri("mongodb://localhost:27017/scheduler")
                .withAddresses(new String[]{"localhost:27018"}), "'Addresses array' parameter is not allowed");
    }

    @Test
    public void databaseNameIsRequired() {
        expectConfigError(MongoConnectorBuilder.builder()
                .withWriteConcernWriteTimeout(5000)
                .withAddresses(new String[]{"localhost"}), "'Database name' is required");
    }

    @Test
    public void addressesOrUriAreRequired() {
        expectConfigError(MongoConnectorBuilder.builder()
                .withWriteConcernWriteTimeout(5000)
                .withDatabaseName("scheduler"), "At least one MongoDB address");
    }

    @Test
    public void unknownWriteConcernIsRejected() {
        expectConfigError(MongoConnectorBuilder.builder()
                .withWriteConcernWriteTimeout(5000)
                .withWriteConcernW("most")
                .withDatabaseName("scheduler")
                .withAddresses(new String[]{"localhost"}), "Unknown write concern");
    }

    @Test
    public void usernameNeedsPassword() {
        expectConfigError(MongoConnectorBuilder.builder()
                .withWriteConcernWriteTimeout(5000)
                .withDatabaseName("scheduler")
                .withAddresses(new String[]{"localhost"})
                .withCredentials("scheduler", null), "Password is required");
    }

    private static void expectConfigError(MongoConnectorBuilder builder, String message) {
        try {
            builder.build();
            fail("expected a SchedulerConfigException containing: " + message);
        } catch (SchedulerConfigException e) {
            assertTrue(e.getMessage(), e.getMessage().contains(message));
        }
    }
}
