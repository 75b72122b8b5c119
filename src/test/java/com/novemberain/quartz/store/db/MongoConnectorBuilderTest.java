package com.novemberain.quartz.store.db;

import com.mongodb.WriteConcern;
import com.mongodb.client.MongoClient;
import org.junit.Test;
import org.quartz.SchedulerConfigException;

import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;
import static org.mockito.Mockito.*;

public class MongoConnectorBuilderTest {

    @Test(expected = SchedulerConfigException.class)
    public void shouldRequireWriteTimeout() throws Exception {
        MongoConnectorBuilder.builder()
                .withUri("mongodb://localhost:27017/quartz")
                .build();
    }

    @Test(expected = SchedulerConfigException.class)
    public void shouldRequireDatabaseName() throws Exception {
        MongoConnectorBuilder.builder()
                .withUri("mongodb://localhost:27017")
                .withWriteConcernWriteTimeout(5000)
                .build();
    }

    @Test(expected = SchedulerConfigException.class)
    public void shouldRequireAddressOrUri() throws Exception {
        MongoConnectorBuilder.builder()
                .withDatabaseName("quartz")
                .withWriteConcernWriteTimeout(5000)
                .build();
    }

    @Test(expected = SchedulerConfigException.class)
    public void shouldRejectInvalidUri() throws Exception {
        MongoConnectorBuilder.builder()
                .withUri("localhost:27017/quartz")
                .withDatabaseName("quartz")
                .withWriteConcernWriteTimeout(5000)
                .build();
    }

    @Test(expected = SchedulerConfigException.class)
    public void shouldRejectAddressesNextToUri() throws Exception {
        MongoConnectorBuilder.builder()
                .withUri("mongodb://localhost:27017/quartz")
                .withAddresses(new String[]{"localhost:27018"})
                .withWriteConcernWriteTimeout(5000)
                .build();
    }

    @Test(expected = SchedulerConfigException.class)
    public void shouldRejectUriNextToClient() throws Exception {
        MongoConnectorBuilder.builder()
                .withClient(mock(MongoClient.class))
                .withUri("mongodb://localhost:27017/quartz")
                .withWriteConcernWriteTimeout(5000)
                .build();
    }

    @Test(expected = SchedulerConfigException.class)
    public void shouldRequirePasswordWithUsername() throws Exception {
        MongoConnectorBuilder.builder()
                .withAddresses(new String[]{"localhost"})
                .withDatabaseName("quartz")
                .withCredentials("scheduler", null)
                .withWriteConcernWriteTimeout(5000)
                .build();
    }

    @Test
    public void shouldResolveDatabaseNameFromUri() throws Exception {
        MongoConnector connector = MongoConnectorBuilder.builder()
                .withUri("mongodb://localhost:27017/scheduling?replicaSet=rs0")
                .withWriteConcernWriteTimeout(5000)
                .build();
        try {
            assertEquals("scheduling", connector.getDatabaseName());
        } finally {
            connector.close();
        }
    }

    @Test
    public void shouldDefaultToJournaledMajorityWriteConcern() throws Exception {
        MongoConnector connector = MongoConnectorBuilder.builder()
                .withAddresses(new String[]{"localhost:27017", " localhost:27018"})
                .withDatabaseName("quartz")
                .withWriteConcernWriteTimeout(2500)
                .build();
        try {
            WriteConcern writeConcern = connector.getWriteConcern();
            assertEquals(WriteConcern.MAJORITY.getWObject(), writeConcern.getWObject());
            assertEquals(Integer.valueOf(2500), writeConcern.getWTimeout(TimeUnit.MILLISECONDS));
            assertEquals(Boolean.TRUE, writeConcern.getJournal());
        } finally {
            connector.close();
        }
    }

    @Test
    public void shouldUseNamedWriteConcern() throws Exception {
        MongoConnector connector = MongoConnectorBuilder.builder()
                .withUri("mongodb://localhost:27017/quartz")
                .withWriteConcernW("W1")
                .withWriteConcernWriteTimeout(5000)
                .build();
        try {
            assertEquals(1, connector.getWriteConcern().getW());
        } finally {
            connector.close();
        }
    }

    @Test
    public void shouldLeaveGivenClientOpen() throws Exception {
        MongoClient client = mock(MongoClient.class, RETURNS_DEEP_STUBS);
        MongoConnector connector = MongoConnectorBuilder.builder()
                .withClient(client)
                .withDatabaseName("quartz")
                .withWriteConcernWriteTimeout(5000)
                .build();
        connector.close();

        verify(client, never()).close();
    }
}
