package de.unibi.cebitec.aws.s3.mirror.model;

import de.unibi.cebitec.aws.s3.mirror.util.S3URI;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

/**
 * Settings of a single mirror run, read from the command line.
 */
public class MirrorConfig {
    public static final int DEFAULT_CONCURRENCY = 50;
    public static final int DEFAULT_QUEUE_CAPACITY = 1000;

    private final String bucket;
    private final String prefix;
    private final Path destination;
    private final int concurrency;
    private final int queueCapacity;
    private String region;
    private String endpoint;
    private String accessKey;
    private String secretKey;
    private String sessionToken;

    public MirrorConfig(String bucket, String prefix, Path destination, int concurrency, int queueCapacity) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("Concurrency must be positive: " + concurrency);
        }
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("Queue capacity must be positive: " + queueCapacity);
        }
        this.bucket = bucket;
        this.prefix = prefix;
        this.destination = destination;
        this.concurrency = concurrency;
        this.queueCapacity = queueCapacity;
    }

    public static Options options() {
        Options options = new Options();
        options
                .addOption(Option.builder("b").longOpt("bucket").hasArg().desc("S3 bucket to mirror from.").build())
                .addOption(Option.builder("p").longOpt("prefix").hasArg().desc("Key prefix of the objects to mirror.").build())
                .addOption(Option.builder("d").longOpt("destination").hasArg().desc("Local destination directory. Created if missing.").build())
                .addOption(Option.builder("c").longOpt("concurrency").hasArg().desc("Number of parallel downloads (default: " + DEFAULT_CONCURRENCY + ").").build())
                .addOption(Option.builder().longOpt("queue-capacity").hasArg().desc("Number of listed keys buffered ahead of the downloads (default: " + DEFAULT_QUEUE_CAPACITY + ").").build())
                .addOption(Option.builder().longOpt("region").hasArg().desc("S3 region (default: region of the bucket).").build())
                .addOption(Option.builder().longOpt("endpoint").hasArg().desc("Endpoint for client authentication (default: standard AWS endpoint).").build())
                .addOption(Option.builder().longOpt("access-key").hasArg().desc("AWS Access Key.").build())
                .addOption(Option.builder().longOpt("secret-key").hasArg().desc("AWS Secret Key.").build())
                .addOption(Option.builder().longOpt("session-token").hasArg().desc("AWS Session Token.").build())
                .addOption(Option.builder().longOpt("debug").desc("Debug mode.").build())
                .addOption(Option.builder().longOpt("trace").desc("Extended debug mode.").build())
                .addOption(Option.builder("q").longOpt("quiet").desc("Disable all log messages.").build())
                .addOption(Option.builder("h").longOpt("help").desc("Help.").build())
                .addOption(Option.builder("v").longOpt("version").desc("Version.").build());
        return options;
    }

    public static MirrorConfig parse(String[] args) throws ParseException {
        CommandLineParser parser = new DefaultParser();
        return fromCommandLine(parser.parse(options(), args));
    }

    public static MirrorConfig fromCommandLine(CommandLine cl) throws ParseException {
        String bucket = cl.getOptionValue("bucket");
        String prefix = cl.getOptionValue("prefix");
        String[] positionalArgs = cl.getArgs();
        if (positionalArgs.length > 1) {
            throw new ParseException("Too many arguments. Only one S3 URL may be given.");
        }
        if (positionalArgs.length == 1) {
            if (bucket != null || prefix != null) {
                throw new ParseException("Either give an S3 URL or --bucket/--prefix, not both.");
            }
            try {
                S3URI s3uri = new S3URI(positionalArgs[0]);
                bucket = s3uri.getBucket();
                prefix = s3uri.getPrefix();
            } catch (URISyntaxException | IllegalArgumentException e) {
                throw new ParseException("Invalid S3 URL: " + e.getMessage());
            }
        }
        if (bucket == null || bucket.isEmpty()) {
            throw new ParseException("Bucket name is required");
        }
        if (prefix == null || prefix.isEmpty()) {
            throw new ParseException("Prefix is required");
        }
        if (!cl.hasOption("destination") || cl.getOptionValue("destination").isEmpty()) {
            throw new ParseException("Destination directory is required");
        }
        int concurrency = positiveInt(cl, "concurrency", DEFAULT_CONCURRENCY);
        int queueCapacity = positiveInt(cl, "queue-capacity", DEFAULT_QUEUE_CAPACITY);

        MirrorConfig config = new MirrorConfig(bucket, prefix, Paths.get(cl.getOptionValue("destination")),
                concurrency, queueCapacity);
        config.region = cl.getOptionValue("region");
        config.endpoint = cl.getOptionValue("endpoint");
        config.accessKey = cl.getOptionValue("access-key");
        config.secretKey = cl.getOptionValue("secret-key");
        config.sessionToken = cl.getOptionValue("session-token");
        return config;
    }

    private static int positiveInt(CommandLine cl, String option, int defaultValue) throws ParseException {
        int value;
        try {
            value = Integer.parseInt(cl.getOptionValue(option, String.valueOf(defaultValue)));
        } catch (NumberFormatException e) {
            throw new ParseException("Invalid integer value for --" + option);
        }
        if (value < 1) {
            throw new ParseException("--" + option + " must be at least 1");
        }
        return value;
    }

    public String getBucket() {
        return bucket;
    }

    public String getPrefix() {
        return prefix;
    }

    public Path getDestination() {
        return destination;
    }

    public int getConcurrency() {
        return concurrency;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public String getRegion() {
        return region;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public String getAccessKey() {
        return accessKey;
    }

    public String getSecretKey() {
        return secretKey;
    }

    public String getSessionToken() {
        return sessionToken;
    }
}
