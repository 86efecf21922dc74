package com.devhub.chat;

import com.devhub.chat.model.Identity;
import com.devhub.chat.model.UserAccount;
import com.devhub.chat.registry.ConnectionRegistry;
import com.devhub.chat.registry.RecordingConnectionHandle;
import com.devhub.chat.repository.UserAccountRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Full application over in-memory H2. Every test creates its own users and rooms,
 * so the shared context needs no cleanup between tests.
 */
@SpringBootTest
public abstract class IntegrationTestSupport {

    private static final AtomicInteger SEQUENCE = new AtomicInteger();

    @Autowired
    protected UserAccountRepository userAccountRepository;

    @Autowired
    protected ConnectionRegistry connectionRegistry;

    protected Identity newUser(String prefix) {
        return newAccount(prefix).toIdentity();
    }

    protected UserAccount newAccount(String prefix) {
        String username = prefix + "-" + SEQUENCE.incrementAndGet();
        return userAccountRepository.save(UserAccount.builder()
                .username(username)
                .accessToken("token-" + UUID.randomUUID())
                .build());
    }

    /** Admits a fresh connection for the identity and returns its recorder. */
    protected RecordingConnectionHandle connect(Identity identity, String connectionId) {
        var handle = new RecordingConnectionHandle();
        connectionRegistry.admit(connectionId, identity, handle);
        return handle;
    }

    protected String connectionId() {
        return "conn-" + UUID.randomUUID();
    }
}
