package io.etl4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.etl4j.DestinationClient;
import io.etl4j.EtlScheduler;
import io.etl4j.FormatConverter;
import io.etl4j.SourceClient;
import io.etl4j.TokenEndpointClient;
import io.etl4j.core.DestinationClientRegistry;
import io.etl4j.core.FormatConverterRegistry;
import io.etl4j.crypto.CredentialCipher;
import io.etl4j.error.ErrorLogger;
import io.etl4j.format.CsvFormatConverter;
import io.etl4j.format.JsonFormatConverter;
import io.etl4j.format.XmlFormatConverter;
import io.etl4j.internal.PollingEtlScheduler;
import io.etl4j.internal.http.RestTemplateTokenEndpointClient;
import io.etl4j.internal.mongo.MongoErrorLogStore;
import io.etl4j.internal.mongo.MongoExecutionStore;
import io.etl4j.internal.mongo.MongoPipelineCatalog;
import io.etl4j.internal.mongo.MongoScheduleStore;
import io.etl4j.internal.mongo.MongoTokenStore;
import io.etl4j.oauth.OAuthManager;
import io.etl4j.oauth.OAuthSettings;
import io.etl4j.pipeline.FieldTransformer;
import io.etl4j.pipeline.FieldType;
import io.etl4j.pipeline.JobExecutionEngine;
import io.etl4j.pipeline.PipelineStages;
import io.etl4j.pipeline.RecordValidator;
import io.etl4j.pipeline.ValidationRules;
import io.etl4j.retry.RetryPolicy;
import io.etl4j.store.ErrorLogStore;
import io.etl4j.store.ExecutionStore;
import io.etl4j.store.PipelineCatalog;
import io.etl4j.store.ScheduleStore;
import io.etl4j.store.TokenStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.MongoTransactionManager;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Spring Boot auto-configuration entrypoint for etl4j components.
 *
 * <p>The application must provide a {@link SourceClient} bean. {@link DestinationClient} and extra
 * {@link FormatConverter} beans are picked up when present.
 */
@AutoConfiguration
@ConditionalOnClass({EtlScheduler.class, MongoTemplate.class})
@EnableConfigurationProperties(EtlProperties.class)
@ConditionalOnProperty(prefix = "etl4j", name = "enabled", havingValue = "true", matchIfMissing = true)
public class EtlAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock etl4jClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public CredentialCipher credentialCipher(EtlProperties props) {
        return new CredentialCipher(props.getCrypto().getMasterSecret(), props.getCrypto().getIterations());
    }

    @Bean
    @ConditionalOnMissingBean(ScheduleStore.class)
    protected MongoScheduleStore mongoScheduleStore(MongoTemplate mongoTemplate, Clock clock) {
        return new MongoScheduleStore(mongoTemplate, clock);
    }

    @Bean
    @ConditionalOnMissingBean(ExecutionStore.class)
    protected MongoExecutionStore mongoExecutionStore(MongoTemplate mongoTemplate) {
        return new MongoExecutionStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean(TokenStore.class)
    protected MongoTokenStore mongoTokenStore(MongoTemplate mongoTemplate, MongoDatabaseFactory databaseFactory) {
        return new MongoTokenStore(mongoTemplate, new TransactionTemplate(new MongoTransactionManager(databaseFactory)));
    }

    @Bean
    @ConditionalOnMissingBean(PipelineCatalog.class)
    protected MongoPipelineCatalog mongoPipelineCatalog(MongoTemplate mongoTemplate) {
        return new MongoPipelineCatalog(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean(ErrorLogStore.class)
    protected MongoErrorLogStore mongoErrorLogStore(MongoTemplate mongoTemplate) {
        return new MongoErrorLogStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public ErrorLogger errorLogger(ErrorLogStore errorLogStore, Clock clock) {
        return new ErrorLogger(errorLogStore, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    protected EtlMongoIndexConfig etlMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new EtlMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public TokenEndpointClient tokenEndpointClient(EtlProperties props, ObjectProvider<ObjectMapper> objectMapper) {
        return RestTemplateTokenEndpointClient.create(
                props.getOauth().getConnectTimeout(),
                props.getOauth().getReadTimeout(),
                objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public OAuthManager oauthManager(EtlProperties props, TokenStore tokenStore, CredentialCipher cipher,
                                     TokenEndpointClient tokenClient, ErrorLogger errorLogger, Clock clock) {
        EtlProperties.OAuth oauth = props.getOauth();
        RetryPolicy retry = RetryPolicy.linear(oauth.getRetry().getMaxAttempts(), oauth.getRetry().getBaseDelay(),
                RetryPolicy.retryableEtlErrors());
        return new OAuthManager(tokenStore, cipher, tokenClient, retry,
                new OAuthSettings(oauth.getRefreshThreshold(), oauth.getStateTtl()), errorLogger, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public JsonFormatConverter jsonFormatConverter(ObjectProvider<ObjectMapper> objectMapper) {
        return new JsonFormatConverter(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public CsvFormatConverter csvFormatConverter() {
        return new CsvFormatConverter();
    }

    @Bean
    @ConditionalOnMissingBean
    public XmlFormatConverter xmlFormatConverter() {
        return new XmlFormatConverter();
    }

    @Bean
    @ConditionalOnMissingBean
    public FormatConverterRegistry formatConverterRegistry(ObjectProvider<List<FormatConverter>> convertersProvider) {
        return new FormatConverterRegistry(convertersProvider.getIfAvailable(List::of));
    }

    @Bean
    @ConditionalOnMissingBean
    public DestinationClientRegistry destinationClientRegistry(ObjectProvider<List<DestinationClient>> clientsProvider) {
        return new DestinationClientRegistry(clientsProvider.getIfAvailable(List::of));
    }

    @Bean
    @ConditionalOnMissingBean
    public RecordValidator recordValidator(EtlProperties props) {
        Map<String, FieldType> types = new LinkedHashMap<>();
        props.getValidation().getFieldTypes()
                .forEach((field, type) -> types.put(field, FieldType.valueOf(type.trim().toUpperCase(Locale.ROOT))));
        return new RecordValidator(new ValidationRules(props.getValidation().getRequiredFields(), types));
    }

    @Bean
    @ConditionalOnMissingBean
    public FieldTransformer fieldTransformer(ObjectProvider<ObjectMapper> objectMapper) {
        return new FieldTransformer(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public PipelineStages pipelineStages(EtlProperties props, PipelineCatalog catalog, SourceClient sourceClient,
                                         RecordValidator validator, FieldTransformer transformer,
                                         FormatConverterRegistry formatConverters,
                                         DestinationClientRegistry destinationClients, OAuthManager oauthManager,
                                         CredentialCipher cipher) {
        EtlProperties.Retry retry = props.getUpload().getRetry();
        RetryPolicy uploadRetry = RetryPolicy.linear(retry.getMaxAttempts(), retry.getBaseDelay(),
                PipelineStages.UPLOAD_RETRYABLE);
        return new PipelineStages(catalog, sourceClient, validator, transformer, formatConverters,
                props.getFormat().getOutputDir(), destinationClients, oauthManager, cipher, uploadRetry);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobExecutionEngine jobExecutionEngine(ScheduleStore scheduleStore, ExecutionStore executionStore,
                                                 TokenStore tokenStore, PipelineStages stages,
                                                 ErrorLogger errorLogger, Clock clock) {
        return new JobExecutionEngine(scheduleStore, executionStore, tokenStore, stages, errorLogger, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public EtlScheduler etlScheduler(EtlProperties props, ScheduleStore scheduleStore, JobExecutionEngine engine,
                                     Clock clock) {
        return new PollingEtlScheduler(props.getScheduler(), scheduleStore, engine, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public EtlLifecycle etlLifecycle(EtlScheduler scheduler) {
        return new EtlLifecycle(scheduler);
    }

    @Bean
    @ConditionalOnProperty(prefix = "etl4j", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton etlIndexesInitializer(EtlMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
