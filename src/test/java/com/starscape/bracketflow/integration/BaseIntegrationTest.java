package com.starscape.bracketflow.integration;

import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.containers.localstack.LocalStackContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.BucketAlreadyOwnedByYouException;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;

import static org.testcontainers.containers.localstack.LocalStackContainer.Service.S3;

/**
 * Base class for integration tests.
 * Runs PostgreSQL and LocalStack S3 in containers; skipped where Docker is unavailable.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Testcontainers(disabledWithoutDocker = true)
public abstract class BaseIntegrationTest {
    
    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("testdb")
            .withUsername("test")
            .withPassword("test");
    
    @Container
    public static LocalStackContainer localstack = new LocalStackContainer(
            DockerImageName.parse("localstack/localstack:3.4"))
            .withServices(S3);
    
    protected static final String TEST_BUCKET = "test-bucket";
    protected static final String CALLBACK_SECRET = "integration-callback-secret";
    
    protected static S3Client s3Client;
    
    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "create-drop");
        
        registry.add("aws.region", () -> localstack.getRegion());
        registry.add("spring.cloud.aws.region.static", () -> localstack.getRegion());
        registry.add("spring.cloud.aws.credentials.access-key", () -> localstack.getAccessKey());
        registry.add("spring.cloud.aws.credentials.secret-key", () -> localstack.getSecretKey());
        registry.add("spring.cloud.aws.sqs.enabled", () -> "false");
        registry.add("aws.s3.bucket", () -> TEST_BUCKET);
        registry.add("aws.s3.endpoint", () -> localstack.getEndpointOverride(S3).toString());
        
        registry.add("app.dispatch.callback-secret", () -> CALLBACK_SECRET);
        registry.add("app.dispatch.callback-url", () -> "http://localhost/callbacks/compute");
        
        AwsBasicCredentials credentials = AwsBasicCredentials.create(
                localstack.getAccessKey(),
                localstack.getSecretKey()
        );
        
        s3Client = S3Client.builder()
                .endpointOverride(localstack.getEndpointOverride(S3))
                .credentialsProvider(StaticCredentialsProvider.create(credentials))
                .region(Region.of(localstack.getRegion()))
                .forcePathStyle(true)
                .build();
        
        try {
            s3Client.createBucket(CreateBucketRequest.builder()
                    .bucket(TEST_BUCKET)
                    .build());
        } catch (BucketAlreadyOwnedByYouException e) {
            // shared container across test classes
        }
    }
    
    /**
     * Number of objects stored under a key prefix in the test bucket.
     */
    protected int countObjects(String prefix) {
        return s3Client.listObjectsV2(ListObjectsV2Request.builder()
                .bucket(TEST_BUCKET)
                .prefix(prefix)
                .build()).contents().size();
    }
}
