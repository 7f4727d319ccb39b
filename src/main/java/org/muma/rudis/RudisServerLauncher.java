package org.muma.rudis;

import org.muma.rudis.config.RudisConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class RudisServerLauncher {

    private static final Logger log = LoggerFactory.getLogger(RudisServerLauncher.class);

    public static void main(String[] args) {
        RudisConfig config = RudisConfig.load(args, System.getenv());
        RedisServer server = new RedisServer(config);

        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "Rudis-Shutdown"));
        try {
            server.start();
            server.awaitTermination();
        } catch (Exception e) {
            log.error("Failed to start server", e);
            server.stop();
            System.exit(1);
        }
    }
}
