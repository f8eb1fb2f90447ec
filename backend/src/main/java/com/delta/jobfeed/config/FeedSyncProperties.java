package com.delta.jobfeed.config;

import com.delta.jobfeed.sync.model.MonitoredCollection;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "feedsync")
public class FeedSyncProperties {
    private static final String DEFAULT_USER_AGENT = "job-feed-sync/0.1 (+ops)";

    private String userAgent;
    private int requestTimeoutSeconds = 30;
    private Remote remote = new Remote();
    private List<Tearsheet> collections = new ArrayList<>();
    private Artifact artifact = new Artifact();
    private Registry registry = new Registry();
    private Snapshot snapshot = new Snapshot();
    private Reissue reissue = new Reissue();
    private RecruiterTags recruiterTags = new RecruiterTags();
    private Publish publish = new Publish();
    private Runner runner = new Runner();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public Remote getRemote() {
        return remote;
    }

    public void setRemote(Remote remote) {
        this.remote = remote;
    }

    public List<Tearsheet> getCollections() {
        return collections;
    }

    public void setCollections(List<Tearsheet> collections) {
        this.collections = collections == null ? new ArrayList<>() : collections;
    }

    public Artifact getArtifact() {
        return artifact;
    }

    public void setArtifact(Artifact artifact) {
        this.artifact = artifact;
    }

    public Registry getRegistry() {
        return registry;
    }

    public void setRegistry(Registry registry) {
        this.registry = registry;
    }

    public Snapshot getSnapshot() {
        return snapshot;
    }

    public void setSnapshot(Snapshot snapshot) {
        this.snapshot = snapshot;
    }

    public Reissue getReissue() {
        return reissue;
    }

    public void setReissue(Reissue reissue) {
        this.reissue = reissue;
    }

    public RecruiterTags getRecruiterTags() {
        return recruiterTags;
    }

    public void setRecruiterTags(RecruiterTags recruiterTags) {
        this.recruiterTags = recruiterTags;
    }

    public Publish getPublish() {
        return publish;
    }

    public void setPublish(Publish publish) {
        this.publish = publish;
    }

    public Runner getRunner() {
        return runner;
    }

    public void setRunner(Runner runner) {
        this.runner = runner;
    }

    public List<MonitoredCollection> monitoredCollections() {
        List<MonitoredCollection> result = new ArrayList<>();
        for (Tearsheet tearsheet : collections) {
            if (tearsheet == null || tearsheet.getId() <= 0) {
                continue;
            }
            result.add(new MonitoredCollection(
                tearsheet.getId(),
                tearsheet.getName(),
                tearsheet.getCompanyName(),
                tearsheet.getApplyDomain()
            ));
        }
        return result;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    private static String blankToDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    public static class Remote {
        private String authorizeUrl = "https://auth.bullhornstaffing.com/oauth/authorize";
        private String tokenUrl = "https://auth.bullhornstaffing.com/oauth/token";
        private String restLoginUrl = "https://rest.bullhornstaffing.com/rest-services/login";
        private String clientId;
        private String clientSecret;
        private String username;
        private String password;
        private String redirectUri;
        private int searchPageSize = 200;
        private int associationPageSize = 200;
        private int maxPages = 50;
        private int smallCollectionThreshold = 5;
        private List<String> acceptingStatuses = new ArrayList<>(List.of("Accepting Candidates", "Open"));
        private List<String> excludedIds = new ArrayList<>(List.of("31939", "34287"));

        public String getAuthorizeUrl() {
            return authorizeUrl;
        }

        public void setAuthorizeUrl(String authorizeUrl) {
            this.authorizeUrl = authorizeUrl;
        }

        public String getTokenUrl() {
            return tokenUrl;
        }

        public void setTokenUrl(String tokenUrl) {
            this.tokenUrl = tokenUrl;
        }

        public String getRestLoginUrl() {
            return restLoginUrl;
        }

        public void setRestLoginUrl(String restLoginUrl) {
            this.restLoginUrl = restLoginUrl;
        }

        public String getClientId() {
            return clientId;
        }

        public void setClientId(String clientId) {
            this.clientId = clientId;
        }

        public String getClientSecret() {
            return clientSecret;
        }

        public void setClientSecret(String clientSecret) {
            this.clientSecret = clientSecret;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public String getRedirectUri() {
            return redirectUri;
        }

        public void setRedirectUri(String redirectUri) {
            this.redirectUri = redirectUri;
        }

        public int getSearchPageSize() {
            return Math.max(1, searchPageSize);
        }

        public void setSearchPageSize(int searchPageSize) {
            this.searchPageSize = Math.max(1, searchPageSize);
        }

        public int getAssociationPageSize() {
            return Math.max(1, associationPageSize);
        }

        public void setAssociationPageSize(int associationPageSize) {
            this.associationPageSize = Math.max(1, associationPageSize);
        }

        public int getMaxPages() {
            return Math.max(1, maxPages);
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = Math.max(1, maxPages);
        }

        public int getSmallCollectionThreshold() {
            return Math.max(0, smallCollectionThreshold);
        }

        public void setSmallCollectionThreshold(int smallCollectionThreshold) {
            this.smallCollectionThreshold = Math.max(0, smallCollectionThreshold);
        }

        public List<String> getAcceptingStatuses() {
            return acceptingStatuses;
        }

        public void setAcceptingStatuses(List<String> acceptingStatuses) {
            this.acceptingStatuses = acceptingStatuses == null ? new ArrayList<>() : acceptingStatuses;
        }

        public List<String> getExcludedIds() {
            return excludedIds;
        }

        public void setExcludedIds(List<String> excludedIds) {
            this.excludedIds = excludedIds == null ? new ArrayList<>() : excludedIds;
        }
    }

    public static class Tearsheet {
        private long id;
        private String name;
        private String companyName;
        private String applyDomain;

        public long getId() {
            return id;
        }

        public void setId(long id) {
            this.id = id;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getCompanyName() {
            return blankToDefault(companyName, "Myticas Consulting");
        }

        public void setCompanyName(String companyName) {
            this.companyName = companyName;
        }

        public String getApplyDomain() {
            return blankToDefault(applyDomain, "apply.myticas.com");
        }

        public void setApplyDomain(String applyDomain) {
            this.applyDomain = applyDomain;
        }
    }

    public static class Artifact {
        private String path = "data/job-feed.xml";
        private String publisherName = "Myticas Consulting";
        private String publisherUrl = "https://www.myticas.com";
        private int lockWaitSeconds = 5;
        private String defaultCountry = "United States";
        private String applyEmail = "apply@myticas.com";

        public String getPath() {
            return blankToDefault(path, "data/job-feed.xml");
        }

        public void setPath(String path) {
            this.path = path;
        }

        public String getPublisherName() {
            return blankToDefault(publisherName, "Myticas Consulting");
        }

        public void setPublisherName(String publisherName) {
            this.publisherName = publisherName;
        }

        public String getPublisherUrl() {
            return blankToDefault(publisherUrl, "https://www.myticas.com");
        }

        public void setPublisherUrl(String publisherUrl) {
            this.publisherUrl = publisherUrl;
        }

        public int getLockWaitSeconds() {
            return Math.max(1, lockWaitSeconds);
        }

        public void setLockWaitSeconds(int lockWaitSeconds) {
            this.lockWaitSeconds = Math.max(1, lockWaitSeconds);
        }

        public String getDefaultCountry() {
            return blankToDefault(defaultCountry, "United States");
        }

        public void setDefaultCountry(String defaultCountry) {
            this.defaultCountry = defaultCountry;
        }

        public String getApplyEmail() {
            return blankToDefault(applyEmail, "apply@myticas.com");
        }

        public void setApplyEmail(String applyEmail) {
            this.applyEmail = applyEmail;
        }
    }

    public static class Registry {
        private String path = "data/reference-codes.json";
        private int codeLength = 10;
        private int maxGenerationAttempts = 1000;

        public String getPath() {
            return blankToDefault(path, "data/reference-codes.json");
        }

        public void setPath(String path) {
            this.path = path;
        }

        public int getCodeLength() {
            return Math.max(6, codeLength);
        }

        public void setCodeLength(int codeLength) {
            this.codeLength = Math.max(6, codeLength);
        }

        public int getMaxGenerationAttempts() {
            return Math.max(1, maxGenerationAttempts);
        }

        public void setMaxGenerationAttempts(int maxGenerationAttempts) {
            this.maxGenerationAttempts = Math.max(1, maxGenerationAttempts);
        }
    }

    public static class Snapshot {
        private String path = "data/previous-records.json";

        public String getPath() {
            return blankToDefault(path, "data/previous-records.json");
        }

        public void setPath(String path) {
            this.path = path;
        }
    }

    public static class Reissue {
        private List<String> fields = new ArrayList<>();

        public List<String> getFields() {
            return fields;
        }

        public void setFields(List<String> fields) {
            this.fields = fields == null ? new ArrayList<>() : fields;
        }
    }

    public static class RecruiterTags {
        private String path;

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }
    }

    public static class Publish {
        private boolean enabled;
        private String targetDirectory;
        private String fileName = "job-feed.xml";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getTargetDirectory() {
            return targetDirectory;
        }

        public void setTargetDirectory(String targetDirectory) {
            this.targetDirectory = targetDirectory;
        }

        public String getFileName() {
            return blankToDefault(fileName, "job-feed.xml");
        }

        public void setFileName(String fileName) {
            this.fileName = fileName;
        }
    }

    public static class Runner {
        private boolean runOnStartup;
        private boolean exitAfterRun;

        public boolean isRunOnStartup() {
            return runOnStartup;
        }

        public void setRunOnStartup(boolean runOnStartup) {
            this.runOnStartup = runOnStartup;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
