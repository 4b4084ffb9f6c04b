package io.jobs4j.utils;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.UUID;

public final class WorkerIds {
    private static final int MAX_LENGTH = 128;

    private WorkerIds() {
    }

    /**
     * Returns {@code configured} when set, otherwise {@code <host>-<pid>-<uuid>}.
     */
    public static String resolve(String configured) {
        if (configured != null && !configured.isBlank()) {
            return configured;
        }

        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            host = "jobs4j";
        }

        String generated = host + "-" + ProcessHandle.current().pid() + "-" + UUID.randomUUID();
        return generated.length() > MAX_LENGTH ? generated.substring(0, MAX_LENGTH) : generated;
    }
}
