package com.novemberain.scheduling.mongodb;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import de.flapdoodle.embed.mongo.MongodExecutable;
import de.flapdoodle.embed.mongo.MongodProcess;
import de.flapdoodle.embed.mongo.MongodStarter;
import de.flapdoodle.embed.mongo.config.MongodConfigBuilder;
import de.flapdoodle.embed.mongo.config.Net;
import de.flapdoodle.embed.mongo.distribution.Version;
import org.junit.After;
import org.junit.Before;

/**
 * Base class for tests running against an embedded MongoDB server, started
 * fresh for every test.
 */
public abstract class AbstractEmbeddedServerTest {

    private MongodExecutable mongodExecutable;
    private MongoClient mongoClient;

    @Before
    public void startServer() throws Exception {
        final MongodStarter runtime = MongodStarter.getDefaultInstance();
        mongodExecutable = runtime.prepare(new MongodConfigBuilder()
                .version(Version.Main.PRODUCTION)
                .net(net())
                .build());
        final MongodProcess mongodProcess = mongodExecutable.start();
        final Net net = mongodProcess.getConfig().net();
        mongoClient = MongoClients.create("mongodb://" + net.getServerAddress().getHostAddress() + ":" + net.getPort());
    }

    public Net net() {
        return new Net("localhost", 27020, false);
    }

    @After
    public void stopServer() {
        if (mongoClient != null) {
            mongoClient.close();
        }
        mongodExecutable.stop();
    }

    protected MongoClient getMongoClient() {
        return mongoClient;
    }
}
