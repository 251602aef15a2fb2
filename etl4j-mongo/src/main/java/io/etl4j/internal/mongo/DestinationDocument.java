package io.etl4j.internal.mongo;

import io.etl4j.core.CredentialState;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Mongo document model for destinations.
 *
 * <p>{@code secrets} is keyed by the sensitive field's wire name and only ever holds ciphertext.
 * {@code credentialsVersion} is bumped by every credential write and guards concurrent refreshes.
 */
@Document(collection = "etl_destinations")
public class DestinationDocument {

    @Id
    private String id;

    private String ownerId;
    private String type;
    private String fileFormat;
    private OAuthProvider oauth;

    private Map<String, String> config;
    private Map<String, SecretBlob> secrets;
    private Instant tokenExpiresAt;
    private CredentialState credentialState;
    private long credentialsVersion;

    private boolean active;

    public DestinationDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public void setOwnerId(String ownerId) {
        this.ownerId = ownerId;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getFileFormat() {
        return fileFormat;
    }

    public void setFileFormat(String fileFormat) {
        this.fileFormat = fileFormat;
    }

    public OAuthProvider getOauth() {
        return oauth;
    }

    public void setOauth(OAuthProvider oauth) {
        this.oauth = oauth;
    }

    public Map<String, String> getConfig() {
        return config;
    }

    public void setConfig(Map<String, String> config) {
        this.config = config;
    }

    public Map<String, SecretBlob> getSecrets() {
        return secrets;
    }

    public void setSecrets(Map<String, SecretBlob> secrets) {
        this.secrets = secrets;
    }

    public Instant getTokenExpiresAt() {
        return tokenExpiresAt;
    }

    public void setTokenExpiresAt(Instant tokenExpiresAt) {
        this.tokenExpiresAt = tokenExpiresAt;
    }

    public CredentialState getCredentialState() {
        return credentialState;
    }

    public void setCredentialState(CredentialState credentialState) {
        this.credentialState = credentialState;
    }

    public long getCredentialsVersion() {
        return credentialsVersion;
    }

    public void setCredentialsVersion(long credentialsVersion) {
        this.credentialsVersion = credentialsVersion;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public static class SecretBlob {
        private String ciphertext;
        private String iv;
        private String salt;
        private String tag;

        public SecretBlob() {
        }

        public String getCiphertext() {
            return ciphertext;
        }

        public void setCiphertext(String ciphertext) {
            this.ciphertext = ciphertext;
        }

        public String getIv() {
            return iv;
        }

        public void setIv(String iv) {
            this.iv = iv;
        }

        public String getSalt() {
            return salt;
        }

        public void setSalt(String salt) {
            this.salt = salt;
        }

        public String getTag() {
            return tag;
        }

        public void setTag(String tag) {
            this.tag = tag;
        }
    }

    public static class OAuthProvider {
        private String provider;
        private String authorizationUrl;
        private String tokenUrl;
        private List<String> scopes;

        public OAuthProvider() {
        }

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getAuthorizationUrl() {
            return authorizationUrl;
        }

        public void setAuthorizationUrl(String authorizationUrl) {
            this.authorizationUrl = authorizationUrl;
        }

        public String getTokenUrl() {
            return tokenUrl;
        }

        public void setTokenUrl(String tokenUrl) {
            this.tokenUrl = tokenUrl;
        }

        public List<String> getScopes() {
            return scopes;
        }

        public void setScopes(List<String> scopes) {
            this.scopes = scopes;
        }
    }
}
