package io.etl4j.pipeline;

import io.etl4j.DestinationClient;
import io.etl4j.FormatConverter;
import io.etl4j.SourceClient;
import io.etl4j.core.Dataset;
import io.etl4j.core.Destination;
import io.etl4j.core.DestinationClientRegistry;
import io.etl4j.core.FormatConverterRegistry;
import io.etl4j.core.FormattedOutput;
import io.etl4j.core.PlainCredentials;
import io.etl4j.core.SelectedApi;
import io.etl4j.core.SensitiveField;
import io.etl4j.core.SourceDefinition;
import io.etl4j.core.TransformationDefinition;
import io.etl4j.crypto.CredentialCipher;
import io.etl4j.error.CryptoException;
import io.etl4j.error.DestinationException;
import io.etl4j.error.EtlException;
import io.etl4j.error.ExtractionException;
import io.etl4j.error.FormatException;
import io.etl4j.error.ProviderException;
import io.etl4j.error.TokenException;
import io.etl4j.oauth.OAuthManager;
import io.etl4j.retry.RetryPolicy;
import io.etl4j.store.PipelineCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * The five pipeline stages. Each consumes the previous stage's full output; failures surface as
 * the stage's own {@link EtlException} subtype with the collaborator error as cause.
 */
public class PipelineStages {
    private static final Logger log = LoggerFactory.getLogger(PipelineStages.class);

    /**
     * Upload failures worth another attempt: anything that is not an {@link EtlException}
     * (I/O, timeouts) plus retryable ones.
     */
    public static final Predicate<Throwable> UPLOAD_RETRYABLE =
            t -> !(t instanceof EtlException e) || e.isRetryable();

    private final PipelineCatalog catalog;
    private final SourceClient sourceClient;
    private final RecordValidator validator;
    private final FieldTransformer transformer;
    private final FormatConverterRegistry formatConverters;
    private final Path outputDir;
    private final DestinationClientRegistry destinationClients;
    private final OAuthManager oauthManager;
    private final CredentialCipher cipher;
    private final RetryPolicy uploadRetry;

    public PipelineStages(PipelineCatalog catalog,
                          SourceClient sourceClient,
                          RecordValidator validator,
                          FieldTransformer transformer,
                          FormatConverterRegistry formatConverters,
                          Path outputDir,
                          DestinationClientRegistry destinationClients,
                          OAuthManager oauthManager,
                          CredentialCipher cipher,
                          RetryPolicy uploadRetry) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.sourceClient = Objects.requireNonNull(sourceClient, "sourceClient must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.transformer = Objects.requireNonNull(transformer, "transformer must not be null");
        this.formatConverters = Objects.requireNonNull(formatConverters, "formatConverters must not be null");
        this.outputDir = Objects.requireNonNull(outputDir, "outputDir must not be null");
        this.destinationClients = Objects.requireNonNull(destinationClients, "destinationClients must not be null");
        this.oauthManager = Objects.requireNonNull(oauthManager, "oauthManager must not be null");
        this.cipher = Objects.requireNonNull(cipher, "cipher must not be null");
        this.uploadRetry = Objects.requireNonNull(uploadRetry, "uploadRetry must not be null");
    }

    /**
     * Fetch every selected API of the source. Not retried here; the source client owns its retry.
     */
    public Dataset extract(String sourceId) {
        SourceDefinition source = catalog.findSource(sourceId)
                .orElseThrow(() -> new ExtractionException("Source not found: " + sourceId,
                        Map.of("sourceId", String.valueOf(sourceId))));

        Map<String, List<Map<String, Object>>> data = new LinkedHashMap<>();
        for (SelectedApi api : source.selectedApis()) {
            try {
                List<Map<String, Object>> records = sourceClient.fetch(source.credentials(), api.endpoint(), api.selectedFields());
                data.put(api.name(), records == null ? List.of() : records);
                log.debug("etl4j extracted sourceId={} api={} records={}", sourceId, api.name(), data.get(api.name()).size());
            } catch (Exception e) {
                throw new ExtractionException("Failed to extract " + api.name() + " from source " + sourceId + ": " + e.getMessage(),
                        Map.of("sourceId", sourceId, "api", api.name(), "endpoint", String.valueOf(api.endpoint())), e);
            }
        }
        return new Dataset(data);
    }

    public ValidationResult validate(Dataset dataset) {
        return validator.validate(dataset);
    }

    /**
     * Apply the transformation; without one (or when it no longer exists) the data passes through.
     */
    public Dataset transform(String transformationId, Dataset dataset) {
        if (transformationId == null || transformationId.isBlank()) {
            return dataset;
        }
        Optional<TransformationDefinition> definition = catalog.findTransformation(transformationId);
        if (definition.isEmpty()) {
            log.warn("etl4j transformation not found, passing data through transformationId={}", transformationId);
            return dataset;
        }
        return transformer.apply(definition.get(), dataset);
    }

    public FormattedOutput format(Dataset dataset, String fileFormat) {
        FormatConverter converter = formatConverters.getRequired(fileFormat);
        try {
            Files.createDirectories(outputDir);
            return converter.convert(dataset, outputDir);
        } catch (FormatException e) {
            throw e;
        } catch (Exception e) {
            throw new FormatException("Failed to convert data to " + fileFormat + ": " + e.getMessage(),
                    Map.of("format", fileFormat), e);
        }
    }

    /**
     * Upload with the shared retry policy. The formatted file is deleted afterwards whatever the outcome.
     *
     * @param listener told about every retry before its backoff
     * @throws DestinationException when credentials are unusable or all attempts failed
     */
    public void upload(FormattedOutput output, Destination destination, RetryPolicy.Listener listener) {
        try {
            DestinationClient client = destinationClients.getRequired(destination.type());
            PlainCredentials credentials = credentialsFor(destination);
            try {
                uploadRetry.execute(() -> {
                    client.upload(output, credentials);
                    return null;
                }, listener);
            } catch (DestinationException e) {
                throw e;
            } catch (ProviderException e) {
                boolean reauth = e.isUnauthorized();
                throw new DestinationException((reauth ? TokenException.REAUTHORIZATION_REQUIRED + ": " : "")
                        + "Upload to " + destination.type() + " failed: " + e.getMessage(),
                        uploadDetails(destination), reauth, e);
            } catch (Exception e) {
                throw new DestinationException("Upload to " + destination.type() + " failed after "
                        + uploadRetry.maxAttempts() + " attempts: " + e.getMessage(), uploadDetails(destination), e);
            }
            log.info("etl4j upload completed destinationId={} type={} file={} size={}",
                    destination.id(), destination.type(), output.path().getFileName(), output.size());
        } finally {
            deleteQuietly(output.path());
        }
    }

    private PlainCredentials credentialsFor(Destination destination) {
        if (destination.requiresOAuth()) {
            try {
                return oauthManager.getDecryptedCredentials(destination.id());
            } catch (TokenException e) {
                throw new DestinationException(e.getMessage().startsWith(TokenException.REAUTHORIZATION_REQUIRED)
                        ? e.getMessage()
                        : TokenException.REAUTHORIZATION_REQUIRED + ": " + e.getMessage(),
                        uploadDetails(destination), true, e);
            } catch (DestinationException e) {
                throw e;
            } catch (EtlException e) {
                throw new DestinationException("Could not obtain credentials for destination " + destination.id()
                        + ": " + e.getMessage(), uploadDetails(destination), e);
            }
        }
        try {
            return new PlainCredentials(destination.credentials().config(),
                    cipher.decryptFields(destination.credentials().secrets(), EnumSet.allOf(SensitiveField.class)));
        } catch (CryptoException e) {
            throw new DestinationException("Failed to decrypt credentials of destination " + destination.id(),
                    uploadDetails(destination), e);
        }
    }

    private static Map<String, Object> uploadDetails(Destination destination) {
        return Map.of("destinationId", String.valueOf(destination.id()), "type", destination.type());
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("etl4j could not delete formatted file path={} msg={}", path, e.getMessage());
        }
    }
}
