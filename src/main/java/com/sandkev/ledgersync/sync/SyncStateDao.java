package com.sandkev.ledgersync.sync;

import com.sandkev.ledgersync.domain.SyncWatermark;

import java.util.List;
import java.util.Optional;

public interface SyncStateDao {

    Optional<SyncWatermark> find(String source);

    void save(SyncWatermark watermark);

    List<SyncWatermark> findAll();
}
