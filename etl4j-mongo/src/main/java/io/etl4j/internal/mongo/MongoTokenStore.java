package io.etl4j.internal.mongo;

import com.mongodb.client.result.UpdateResult;
import io.etl4j.core.CredentialAuditRecord;
import io.etl4j.core.Destination;
import io.etl4j.core.DestinationCredentials;
import io.etl4j.core.EncryptedBlob;
import io.etl4j.core.OAuthProviderConfig;
import io.etl4j.core.OAuthState;
import io.etl4j.core.SensitiveField;
import io.etl4j.error.StaleCredentialsException;
import io.etl4j.store.TokenStore;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence for destination credentials, OAuth states and the credential audit log.
 *
 * <p>A credential update and its audit record are written in one transaction, so the audit log
 * never shows a change that did not happen. This needs a replica set.
 */
public class MongoTokenStore implements TokenStore {

    private final MongoTemplate mongoTemplate;
    private final TransactionTemplate transactionTemplate;

    public MongoTokenStore(MongoTemplate mongoTemplate, TransactionTemplate transactionTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.transactionTemplate = Objects.requireNonNull(transactionTemplate, "transactionTemplate must not be null");
    }

    @Override
    public Optional<Destination> findDestination(String destinationId) {
        Objects.requireNonNull(destinationId, "destinationId must not be null");
        return Optional.ofNullable(mongoTemplate.findById(destinationId, DestinationDocument.class))
                .map(MongoTokenStore::toDestination);
    }

    @Override
    public void saveState(OAuthState state) {
        Objects.requireNonNull(state, "state must not be null");
        OAuthStateDocument doc = new OAuthStateDocument();
        doc.setId(state.state());
        doc.setUserId(state.userId());
        doc.setDestinationId(state.destinationId());
        doc.setProvider(state.provider());
        doc.setExpiresAt(state.expiresAt());
        mongoTemplate.insert(doc);
    }

    @Override
    public Optional<OAuthState> consumeState(String state, Instant now) {
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(now, "now must not be null");

        Query q = new Query(
                Criteria.where("_id").is(state)
                        .and("expiresAt").gt(now)
        );
        OAuthStateDocument doc = mongoTemplate.findAndRemove(q, OAuthStateDocument.class);
        if (doc == null) {
            return Optional.empty();
        }
        return Optional.of(new OAuthState(doc.getId(), doc.getUserId(), doc.getDestinationId(), doc.getProvider(),
                doc.getExpiresAt()));
    }

    @Override
    public long updateCredentials(String destinationId, long expectedVersion, DestinationCredentials updated,
                                  CredentialAuditRecord audit) {
        Objects.requireNonNull(destinationId, "destinationId must not be null");
        Objects.requireNonNull(updated, "updated must not be null");
        Objects.requireNonNull(audit, "audit must not be null");

        Long version = transactionTemplate.execute(status -> {
            Query q = new Query(
                    Criteria.where("_id").is(destinationId)
                            .and("credentialsVersion").is(expectedVersion)
            );
            Update u = new Update()
                    .set("config", updated.config())
                    .set("secrets", toSecretDocuments(updated.secrets()))
                    .set("tokenExpiresAt", updated.tokenExpiresAt())
                    .set("credentialState", updated.state())
                    .inc("credentialsVersion", 1);

            UpdateResult r = mongoTemplate.updateFirst(q, u, DestinationDocument.class);
            if (r.getMatchedCount() == 0) {
                // Thrown inside the callback so the transaction rolls back.
                throw new StaleCredentialsException(destinationId, expectedVersion);
            }

            CredentialAuditDocument doc = new CredentialAuditDocument();
            doc.setDestinationId(destinationId);
            doc.setAction(audit.action());
            doc.setOldCredentials(audit.oldCredentials());
            doc.setNewCredentials(audit.newCredentials());
            doc.setRecordedAt(audit.recordedAt());
            mongoTemplate.insert(doc);

            return expectedVersion + 1;
        });
        return Objects.requireNonNull(version, "transaction returned no version");
    }

    @Override
    public List<CredentialAuditRecord> findAudit(String destinationId) {
        Objects.requireNonNull(destinationId, "destinationId must not be null");
        Query q = new Query(Criteria.where("destinationId").is(destinationId));
        q.with(Sort.by(Sort.Order.asc("recordedAt"), Sort.Order.asc("_id")));
        return mongoTemplate.find(q, CredentialAuditDocument.class).stream()
                .map(d -> new CredentialAuditRecord(d.getDestinationId(), d.getAction(), d.getOldCredentials(),
                        d.getNewCredentials(), d.getRecordedAt()))
                .toList();
    }

    @Override
    public long purgeExpiredStates(Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        Query q = new Query(Criteria.where("expiresAt").lte(now));
        return mongoTemplate.remove(q, OAuthStateDocument.class).getDeletedCount();
    }

    private static Map<String, DestinationDocument.SecretBlob> toSecretDocuments(Map<SensitiveField, EncryptedBlob> secrets) {
        Map<String, DestinationDocument.SecretBlob> out = new LinkedHashMap<>();
        secrets.forEach((field, blob) -> {
            DestinationDocument.SecretBlob doc = new DestinationDocument.SecretBlob();
            doc.setCiphertext(blob.ciphertext());
            doc.setIv(blob.iv());
            doc.setSalt(blob.salt());
            doc.setTag(blob.tag());
            out.put(field.wireName(), doc);
        });
        return out;
    }

    static Destination toDestination(DestinationDocument doc) {
        EnumMap<SensitiveField, EncryptedBlob> secrets = new EnumMap<>(SensitiveField.class);
        if (doc.getSecrets() != null) {
            doc.getSecrets().forEach((name, blob) -> SensitiveField.fromWireName(name)
                    .ifPresent(field -> secrets.put(field,
                            new EncryptedBlob(blob.getCiphertext(), blob.getIv(), blob.getSalt(), blob.getTag()))));
        }
        DestinationCredentials credentials = new DestinationCredentials(doc.getConfig(), secrets,
                doc.getTokenExpiresAt(), doc.getCredentialState());

        OAuthProviderConfig oauth = null;
        DestinationDocument.OAuthProvider p = doc.getOauth();
        if (p != null) {
            oauth = new OAuthProviderConfig(p.getProvider(), p.getAuthorizationUrl(), p.getTokenUrl(), p.getScopes());
        }

        return new Destination(doc.getId(), doc.getOwnerId(), doc.getType(), doc.getFileFormat(), oauth, credentials,
                doc.getCredentialsVersion(), doc.isActive());
    }
}
