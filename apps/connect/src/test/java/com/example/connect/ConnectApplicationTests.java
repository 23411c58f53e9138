package com.example.connect;

import com.example.connect.credential.store.CredentialStore;
import com.example.connect.credential.store.InMemoryCredentialStore;
import com.example.connect.flow.state.InMemoryOAuthStateStore;
import com.example.connect.flow.state.OAuthStateStore;
import com.example.connect.token.lock.LocalRefreshLock;
import com.example.connect.token.lock.RefreshLock;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class ConnectApplicationTests {

    @Autowired
    private CredentialStore credentialStore;

    @Autowired
    private OAuthStateStore stateStore;

    @Autowired
    private RefreshLock refreshLock;

    @Test
    void contextLoadsWithSingleInstanceDefaults() {
        assertThat(credentialStore).isInstanceOf(InMemoryCredentialStore.class);
        assertThat(stateStore).isInstanceOf(InMemoryOAuthStateStore.class);
        assertThat(refreshLock).isInstanceOf(LocalRefreshLock.class);
    }
}
