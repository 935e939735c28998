package io.contextlink.push;

import io.contextlink.server.ClientRecord;

import java.util.List;
import java.util.Optional;

public interface ActiveTabRegistry {
    Optional<ClientRecord> currentTarget();

    Optional<ClientRecord> findByTabId(String tabId);

    List<ClientRecord> recipients();
}
