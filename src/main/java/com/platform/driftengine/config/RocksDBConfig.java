package com.platform.driftengine.config;

import org.rocksdb.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Configuration
public class RocksDBConfig {

    private static final Logger log = LoggerFactory.getLogger(RocksDBConfig.class);

    public static final String CF_BASELINES = "baselines";

    @Value("${drift-engine.rocksdb.path:/tmp/drift-engine/rocksdb}")
    private String dbPath;

    @Value("${drift-engine.rocksdb.block-cache-size-mb:256}")
    private int blockCacheSizeMb;

    private RocksDB db;
    private final List<ColumnFamilyHandle> cfHandles = new ArrayList<>();

    @Bean
    public RocksDB rocksDB() throws RocksDBException, IOException {
        RocksDB.loadLibrary();

        Files.createDirectories(Path.of(dbPath));
        db = RocksDB.open(new DBOptions()
                        .setCreateIfMissing(true)
                        .setCreateMissingColumnFamilies(true)
                        .setMaxOpenFiles(500)
                        .setMaxBackgroundJobs(2),
                dbPath, columnFamilyDescriptors(blockCacheSizeMb), cfHandles);
        log.info("RocksDB opened at {} with {} column families", dbPath, cfHandles.size());
        return db;
    }

    @Bean
    public Map<String, ColumnFamilyHandle> columnFamilyHandles(RocksDB rocksDB) {
        return handleMap(cfHandles);
    }

    /**
     * Default CF plus {@code baselines}, tuned for point lookups of
     * medium-sized JSON values.
     */
    public static List<ColumnFamilyDescriptor> columnFamilyDescriptors(int blockCacheSizeMb) {
        List<ColumnFamilyDescriptor> descriptors = new ArrayList<>();
        descriptors.add(new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY, new ColumnFamilyOptions()));

        ColumnFamilyOptions baselineOpts = new ColumnFamilyOptions()
                .setTableFormatConfig(new BlockBasedTableConfig()
                        .setFilterPolicy(new BloomFilter(10))
                        .setBlockCache(new LRUCache(blockCacheSizeMb * 1024L * 1024L)))
                .setCompressionType(CompressionType.LZ4_COMPRESSION);
        descriptors.add(new ColumnFamilyDescriptor(CF_BASELINES.getBytes(StandardCharsets.UTF_8), baselineOpts));
        return descriptors;
    }

    /**
     * Name the handles returned by {@link RocksDB#open} in descriptor order.
     */
    public static Map<String, ColumnFamilyHandle> handleMap(List<ColumnFamilyHandle> handles) {
        String[] names = {"default", CF_BASELINES};
        Map<String, ColumnFamilyHandle> handleMap = new HashMap<>();
        for (int i = 0; i < handles.size(); i++) {
            handleMap.put(names[i], handles.get(i));
        }
        return handleMap;
    }

    @PreDestroy
    public void close() {
        log.info("Closing RocksDB...");
        cfHandles.forEach(ColumnFamilyHandle::close);
        if (db != null) {
            db.close();
        }
    }
}
