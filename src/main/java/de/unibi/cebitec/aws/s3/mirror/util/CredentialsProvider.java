package de.unibi.cebitec.aws.s3.mirror.util;

import com.amazonaws.auth.AWSCredentials;
import com.amazonaws.auth.AWSCredentialsProvider;
import com.amazonaws.auth.AWSStaticCredentialsProvider;
import com.amazonaws.auth.BasicAWSCredentials;
import com.amazonaws.auth.BasicSessionCredentials;
import com.amazonaws.auth.DefaultAWSCredentialsProviderChain;
import com.amazonaws.auth.PropertiesCredentials;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves credentials in this order: explicit keys, the properties file in the user's home, the SDK default chain.
 */
public class CredentialsProvider {
    private static final Logger log = LoggerFactory.getLogger(CredentialsProvider.class);
    public static final String DEFAULT_PROPERTIES_FILENAME = ".aws-credentials.properties";

    private final Path propertiesFile;

    public CredentialsProvider() {
        this(Paths.get(System.getProperty("user.home"), DEFAULT_PROPERTIES_FILENAME));
    }

    public CredentialsProvider(Path propertiesFile) {
        this.propertiesFile = propertiesFile;
    }

    public AWSCredentialsProvider resolve(String accessKey, String secretKey, String sessionToken) {
        if (accessKey != null && secretKey != null) {
            AWSCredentials credentials = sessionToken == null
                    ? new BasicAWSCredentials(accessKey, secretKey)
                    : new BasicSessionCredentials(accessKey, secretKey, sessionToken);
            return new AWSStaticCredentialsProvider(credentials);
        }
        AWSCredentials fileCredentials = fromPropertiesFile();
        if (fileCredentials != null) {
            return new AWSStaticCredentialsProvider(fileCredentials);
        }
        log.debug("No explicit credentials given. Using the default provider chain.");
        return DefaultAWSCredentialsProviderChain.getInstance();
    }

    AWSCredentials fromPropertiesFile() {
        if (!Files.isReadable(this.propertiesFile)) {
            return null;
        }
        try (InputStream in = Files.newInputStream(this.propertiesFile)) {
            return new PropertiesCredentials(in);
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Could not read credentials from {} ({})", this.propertiesFile, e.getMessage());
            return null;
        }
    }
}
