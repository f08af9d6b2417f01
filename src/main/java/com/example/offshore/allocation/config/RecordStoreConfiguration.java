package com.example.offshore.allocation.config;

import com.example.offshore.allocation.model.RecordKind;
import com.example.offshore.allocation.model.VesselManifestDocument;
import com.example.offshore.allocation.model.VoyageEventDocument;
import com.example.offshore.allocation.store.MongoOperationalRecordStore;
import com.example.offshore.allocation.store.OperationalRecordStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.MongoTransactionManager;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.transaction.support.TransactionTemplate;

@Slf4j
@Configuration
public class RecordStoreConfiguration {

    /**
     * Batch writes run inside Mongo multi-document transactions, which need a replica set deployment.
     */
    @Bean
    public MongoTransactionManager transactionManager(MongoDatabaseFactory databaseFactory) {
        return new MongoTransactionManager(databaseFactory);
    }

    @Bean
    public TransactionTemplate batchTransactionTemplate(MongoTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }

    @Bean
    public OperationalRecordStore voyageEventStore(MongoTemplate mongoTemplate, TransactionTemplate batchTransactionTemplate) {
        log.debug("Registering record store for {}", RecordKind.VOYAGE_EVENT.collectionName());
        return new MongoOperationalRecordStore(mongoTemplate, batchTransactionTemplate, RecordKind.VOYAGE_EVENT,
                VoyageEventDocument.class);
    }

    @Bean
    public OperationalRecordStore manifestStore(MongoTemplate mongoTemplate, TransactionTemplate batchTransactionTemplate) {
        log.debug("Registering record store for {}", RecordKind.MANIFEST_LINE.collectionName());
        return new MongoOperationalRecordStore(mongoTemplate, batchTransactionTemplate, RecordKind.MANIFEST_LINE,
                VesselManifestDocument.class);
    }
}
