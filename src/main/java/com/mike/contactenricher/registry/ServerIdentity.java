package com.mike.contactenricher.registry;

import com.mike.contactenricher.config.EnricherProperties;
import lombok.Value;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Locale;

@Value
public class ServerIdentity {

    String id;
    String name;
    String hostname;
    String region;

    public static ServerIdentity resolve(EnricherProperties.Server server) {
        String hostname = localHostname();

        String id = server.getId();
        if (id == null || id.isBlank()) {
            id = hostname.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9-]", "-");
        }
        if (id.length() > 50) {
            id = id.substring(0, 50);
        }

        String name = (server.getName() == null || server.getName().isBlank()) ? id : server.getName();

        return new ServerIdentity(id, name, hostname, server.getRegion());
    }

    private static String localHostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "unknown-host";
        }
    }
}
