package com.example.workscheduler.service.lock;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;

/**
 * Identity of this process for lease ownership and queue attribution.
 * <p>
 * Derived from the process start time plus a random suffix, so it is unique
 * per process lifetime and never reused after a restart.
 */
@Getter
@Component
public class InstanceIdentity {

    private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int SUFFIX_LENGTH = 9;

    private final String instanceId;

    @Autowired
    public InstanceIdentity(Clock clock) {
        this.instanceId = "instance-" + clock.millis() + "-" + randomSuffix();
    }

    InstanceIdentity(String instanceId) {
        this.instanceId = instanceId;
    }

    public static InstanceIdentity of(String instanceId) {
        return new InstanceIdentity(instanceId);
    }

    private static String randomSuffix() {
        var random = new SecureRandom();
        var sb = new StringBuilder(SUFFIX_LENGTH);
        for (var i = 0; i < SUFFIX_LENGTH; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return instanceId;
    }
}
