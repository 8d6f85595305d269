package de.unibi.cebitec.aws.s3.mirror;

import com.amazonaws.AmazonClientException;
import com.amazonaws.ClientConfiguration;
import com.amazonaws.auth.AWSCredentialsProvider;
import com.amazonaws.client.builder.AwsClientBuilder;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.AmazonS3ClientBuilder;
import de.unibi.cebitec.aws.s3.mirror.ctrl.MirrorDownloader;
import de.unibi.cebitec.aws.s3.mirror.model.MirrorConfig;
import de.unibi.cebitec.aws.s3.mirror.model.MirrorResult;
import de.unibi.cebitec.aws.s3.mirror.store.NioLocalFileSystem;
import de.unibi.cebitec.aws.s3.mirror.store.S3ObjectFetcher;
import de.unibi.cebitec.aws.s3.mirror.store.S3ObjectLister;
import de.unibi.cebitec.aws.s3.mirror.util.BucketRegionResolver;
import de.unibi.cebitec.aws.s3.mirror.util.CredentialsProvider;
import java.io.IOException;
import java.net.URL;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Locale;
import java.util.jar.JarFile;
import java.util.jar.Manifest;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * BiBiS3 Mirror. Copies every object below an S3 prefix into a local directory tree. Downloads start while the
 * listing of the prefix is still running, so large prefixes are transferred at full speed from the first page on.
 *
 * <p>Exit status: 0 on success, 1 on a fatal error or invalid arguments, 2 if the listing was cut short by an error
 * and keys after the failed page were never mirrored.</p>
 */
public class BiBiS3Mirror {
    public static final Logger log = LoggerFactory.getLogger(BiBiS3Mirror.class);
    public static final int RETRIES = 6;
    public static final int EXIT_OK = 0;
    public static final int EXIT_FATAL = 1;
    public static final int EXIT_LISTING_INCOMPLETE = 2;

    /**
     * We disable the logging of the SDK (mostly used by the Apache HTTP Client)
     * as all the important information is thrown as exceptions anyway.
     */
    static {
        System.setProperty("org.apache.commons.logging.Log", "org.apache.commons.logging.impl.NoOpLog");
    }

    public static void main(String[] args) {
        Locale.setDefault(Locale.ENGLISH);
        System.exit(run(args));
    }

    static int run(String[] args) {
        Options options = MirrorConfig.options();

        // Get the root logger instance of the logback logger implementation to be able to set the logging level at runtime.
        ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        root.setLevel(ch.qos.logback.classic.Level.INFO);

        MirrorConfig config;
        try {
            CommandLine cl = new DefaultParser().parse(options, args);
            if (cl.hasOption("h")) {
                printHelp(options);
                return EXIT_OK;
            }
            if (cl.hasOption("v")) {
                System.out.println(versionInfo());
                return EXIT_OK;
            }
            if (cl.hasOption("debug")) {
                root.setLevel(ch.qos.logback.classic.Level.DEBUG);
            }
            if (cl.hasOption("trace")) {
                root.setLevel(ch.qos.logback.classic.Level.TRACE);
            }
            if (cl.hasOption("q")) {
                root.setLevel(ch.qos.logback.classic.Level.OFF);
            }
            config = MirrorConfig.fromCommandLine(cl);
        } catch (ParseException e) {
            log.error("{}", e.getMessage());
            printHelp(options);
            return EXIT_FATAL;
        }

        try {
            Files.createDirectories(config.getDestination());
        } catch (IOException e) {
            log.error("Failed to create destination directory '{}': {}", config.getDestination(), e.toString());
            return EXIT_FATAL;
        }

        try {
            AmazonS3 s3 = createClient(config);
            MirrorDownloader down = new MirrorDownloader(new S3ObjectLister(s3), new S3ObjectFetcher(s3),
                    new NioLocalFileSystem(), config.getBucket(), config.getPrefix(), config.getDestination(),
                    config.getConcurrency(), config.getQueueCapacity());
            MirrorResult result = down.download();
            return exitStatus(result);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while waiting for the download to finish.");
        } catch (AmazonClientException e) {
            log.error("S3 Error: {}", e.toString());
        } catch (Exception e) {
            log.error("An error occurred during the transfer: {}", e.toString());
            log.trace("{}", Arrays.asList(e.getStackTrace()));
        }
        return EXIT_FATAL;
    }

    static int exitStatus(MirrorResult result) {
        if (result.isAborted()) {
            log.error("Fatal: failed to mirror '{}' ({}): {}", result.getFailure().getKey(),
                    result.getFailure().getReason(), result.getFailure().getMessage());
            return EXIT_FATAL;
        }
        if (!result.isListingComplete()) {
            log.error("The listing was cut short by an error. Keys after the failed page were not mirrored.");
            return EXIT_LISTING_INCOMPLETE;
        }
        log.info("Download successful.");
        return EXIT_OK;
    }

    private static AmazonS3 createClient(MirrorConfig config) {
        // tweak connection settings to minimize timeouts
        ClientConfiguration clientConfig = new ClientConfiguration();
        clientConfig.setConnectionTimeout(1000 * 30); // 30 sec
        clientConfig.setSocketTimeout(1000 * 30); // 30 sec
        clientConfig.setMaxErrorRetry(RETRIES);
        clientConfig.setMaxConnections(config.getConcurrency() + 10);

        AWSCredentialsProvider credentials = new CredentialsProvider()
                .resolve(config.getAccessKey(), config.getSecretKey(), config.getSessionToken());

        String region = config.getRegion();
        if (region == null && config.getEndpoint() == null) {
            AmazonS3 locator = AmazonS3ClientBuilder.standard()
                    .withRegion(BucketRegionResolver.DEFAULT_REGION)
                    .withClientConfiguration(clientConfig)
                    .withCredentials(credentials)
                    .build();
            try {
                region = new BucketRegionResolver(locator, RETRIES).resolve(config.getBucket());
            } finally {
                locator.shutdown();
            }
        }
        if (region == null) {
            region = BucketRegionResolver.DEFAULT_REGION;
        }
        log.info("== Bucket '{}' is in region '{}'", config.getBucket(), region);

        AmazonS3ClientBuilder builder = AmazonS3ClientBuilder.standard();
        builder = config.getEndpoint() == null ?
                builder.withRegion(region) :
                builder.withEndpointConfiguration(new AwsClientBuilder.EndpointConfiguration(config.getEndpoint(), region))
                        .withPathStyleAccessEnabled(true);
        return builder.withClientConfiguration(clientConfig)
                .withCredentials(credentials)
                .build();
    }

    private static String versionInfo() {
        try {
            URL jarUrl = BiBiS3Mirror.class.getProtectionDomain().getCodeSource().getLocation();
            String jarPath = URLDecoder.decode(jarUrl.getFile(), StandardCharsets.UTF_8);
            try (JarFile jarFile = new JarFile(jarPath)) {
                Manifest m = jarFile.getManifest();
                return String.format("Version: %s\nBuild: %s",
                        m.getMainAttributes().getValue("Version"), m.getMainAttributes().getValue("Build"));
            }
        } catch (Exception e) {
            log.error("Version info could not be read.");
            return "Version: unknown";
        }
    }

    private static void printHelp(Options opts) {
        HelpFormatter help = new HelpFormatter();
        // Determine jar filename.
        String jarFilename;
        try {
            String uri = BiBiS3Mirror.class.getProtectionDomain().getCodeSource().getLocation().toURI().toString();
            jarFilename = uri.substring(uri.lastIndexOf("/") + 1);
        } catch (Exception e) {
            jarFilename = "<jarfile>";
        }
        String footer = "Either give the source as S3 URL 's3://<bucket>/<prefix>' or use --bucket and --prefix. " +
                "Every key below the prefix is written to <destination>/<key>.";
        help.printHelp("java -jar " + jarFilename + " [s3://bucket/prefix] -d DEST", "", opts, footer);
    }
}
