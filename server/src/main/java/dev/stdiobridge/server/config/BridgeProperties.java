package dev.stdiobridge.server.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

import dev.stdiobridge.server.broker.BrokerSettings;
import dev.stdiobridge.server.filter.FilterConfig;
import dev.stdiobridge.server.process.ChildProcessSettings;

/**
 * Configuration of the bridge, bound from the {@code bridge.*} properties.
 */
@ConfigurationProperties(prefix = "bridge")
public class BridgeProperties {

	private final Process process = new Process();

	private final Session session = new Session();

	private final Broker broker = new Broker();

	private final WebSocket websocket = new WebSocket();

	private final Filters filters = new Filters();

	public Process getProcess() {
		return this.process;
	}

	public Session getSession() {
		return this.session;
	}

	public Broker getBroker() {
		return this.broker;
	}

	public WebSocket getWebsocket() {
		return this.websocket;
	}

	public Filters getFilters() {
		return this.filters;
	}

	/**
	 * The child process to bridge.
	 */
	public static class Process {

		/**
		 * Program and arguments of the child.
		 */
		private List<String> command = new ArrayList<>();

		/**
		 * Directory the child starts in. Defaults to the bridge's working directory.
		 */
		private String workingDirectory;

		/**
		 * Variables added to the environment inherited by the child.
		 */
		private Map<String, String> environment = new LinkedHashMap<>();

		/**
		 * How long to wait for the child to exit before killing it.
		 */
		private Duration shutdownGracePeriod = ChildProcessSettings.DEFAULT_SHUTDOWN_GRACE_PERIOD;

		/**
		 * Send an initialize request on start and log whether the child answers.
		 */
		private boolean healthProbe = true;

		private Duration healthProbeTimeout = ChildProcessSettings.DEFAULT_HEALTH_PROBE_TIMEOUT;

		public List<String> getCommand() {
			return this.command;
		}

		public void setCommand(List<String> command) {
			this.command = command;
		}

		public String getWorkingDirectory() {
			return this.workingDirectory;
		}

		public void setWorkingDirectory(String workingDirectory) {
			this.workingDirectory = workingDirectory;
		}

		public Map<String, String> getEnvironment() {
			return this.environment;
		}

		public void setEnvironment(Map<String, String> environment) {
			this.environment = environment;
		}

		public Duration getShutdownGracePeriod() {
			return this.shutdownGracePeriod;
		}

		public void setShutdownGracePeriod(Duration shutdownGracePeriod) {
			this.shutdownGracePeriod = shutdownGracePeriod;
		}

		public boolean isHealthProbe() {
			return this.healthProbe;
		}

		public void setHealthProbe(boolean healthProbe) {
			this.healthProbe = healthProbe;
		}

		public Duration getHealthProbeTimeout() {
			return this.healthProbeTimeout;
		}

		public void setHealthProbeTimeout(Duration healthProbeTimeout) {
			this.healthProbeTimeout = healthProbeTimeout;
		}

		/**
		 * Launch settings for the supervisor.
		 * @return settings with the working directory resolved to an absolute path
		 */
		public ChildProcessSettings toSettings() {
			Path directory = StringUtils.hasText(this.workingDirectory)
					? Paths.get(this.workingDirectory).toAbsolutePath().normalize() : null;
			return new ChildProcessSettings(this.command, directory, this.environment, this.shutdownGracePeriod,
					this.healthProbe, this.healthProbeTimeout);
		}

	}

	/**
	 * Per-session limits.
	 */
	public static class Session {

		/**
		 * Outbound frames held per session before the newest are dropped.
		 */
		private int queueCapacity = 100;

		/**
		 * Sessions without client activity for longer than this are removed.
		 */
		private Duration maxIdle = Duration.ofSeconds(300);

		/**
		 * Interval of the idle sweep, in milliseconds.
		 */
		private long sweepIntervalMs = 30_000;

		/**
		 * How long a streaming consumer waits before receiving a heartbeat.
		 */
		private Duration heartbeatInterval = Duration.ofSeconds(15);

		public int getQueueCapacity() {
			return this.queueCapacity;
		}

		public void setQueueCapacity(int queueCapacity) {
			this.queueCapacity = queueCapacity;
		}

		public Duration getMaxIdle() {
			return this.maxIdle;
		}

		public void setMaxIdle(Duration maxIdle) {
			this.maxIdle = maxIdle;
		}

		public long getSweepIntervalMs() {
			return this.sweepIntervalMs;
		}

		public void setSweepIntervalMs(long sweepIntervalMs) {
			this.sweepIntervalMs = sweepIntervalMs;
		}

		public Duration getHeartbeatInterval() {
			return this.heartbeatInterval;
		}

		public void setHeartbeatInterval(Duration heartbeatInterval) {
			this.heartbeatInterval = heartbeatInterval;
		}

	}

	/**
	 * Routing limits.
	 */
	public static class Broker {

		private int maxInFlight = BrokerSettings.DEFAULT_MAX_IN_FLIGHT;

		private Duration permitPollInterval = BrokerSettings.DEFAULT_PERMIT_POLL_INTERVAL;

		/**
		 * Age after which a request that got no response is forgotten. Zero disables expiry.
		 */
		private Duration correlationTtl = BrokerSettings.DEFAULT_CORRELATION_TTL;

		public int getMaxInFlight() {
			return this.maxInFlight;
		}

		public void setMaxInFlight(int maxInFlight) {
			this.maxInFlight = maxInFlight;
		}

		public Duration getPermitPollInterval() {
			return this.permitPollInterval;
		}

		public void setPermitPollInterval(Duration permitPollInterval) {
			this.permitPollInterval = permitPollInterval;
		}

		public Duration getCorrelationTtl() {
			return this.correlationTtl;
		}

		public void setCorrelationTtl(Duration correlationTtl) {
			this.correlationTtl = correlationTtl;
		}

		public BrokerSettings toSettings() {
			return new BrokerSettings(this.maxInFlight, this.permitPollInterval, this.correlationTtl);
		}

	}

	/**
	 * WebSocket delivery endpoint.
	 */
	public static class WebSocket {

		private boolean enabled = true;

		private String endpoint = "/bridge";

		/**
		 * Longest a single send to a client may take before the socket is dropped.
		 */
		private Duration sendTimeLimit = Duration.ofSeconds(10);

		/**
		 * Bytes that may wait for a slow client before the socket is dropped.
		 */
		private int sendBufferSizeLimit = 512 * 1024;

		public boolean isEnabled() {
			return this.enabled;
		}

		public void setEnabled(boolean enabled) {
			this.enabled = enabled;
		}

		public String getEndpoint() {
			return this.endpoint;
		}

		public void setEndpoint(String endpoint) {
			this.endpoint = endpoint;
		}

		public Duration getSendTimeLimit() {
			return this.sendTimeLimit;
		}

		public void setSendTimeLimit(Duration sendTimeLimit) {
			this.sendTimeLimit = sendTimeLimit;
		}

		public int getSendBufferSizeLimit() {
			return this.sendBufferSizeLimit;
		}

		public void setSendBufferSizeLimit(int sendBufferSizeLimit) {
			this.sendBufferSizeLimit = sendBufferSizeLimit;
		}

	}

	/**
	 * Initial filter configuration. Every unset value keeps its built-in default.
	 */
	public static class Filters {

		private Map<String, Boolean> toggles = new LinkedHashMap<>();

		private List<String> blockedDomains = new ArrayList<>();

		private List<String> blockedKeywords = new ArrayList<>();

		private List<String> blockedPatterns = new ArrayList<>();

		private boolean removeScripts = true;

		private boolean removeTracking = true;

		private boolean removeAds = true;

		private boolean normalizeWhitespace = true;

		private boolean redactEmails = true;

		private boolean redactPhones = true;

		private boolean redactSsns = true;

		private boolean redactCreditCards = true;

		private int maxResponseLength = FilterConfig.DEFAULT_MAX_RESPONSE_LENGTH;

		private int summarizeThreshold = FilterConfig.DEFAULT_SUMMARIZE_THRESHOLD;

		private boolean enableCaching = true;

		private Duration cacheTtl = FilterConfig.DEFAULT_CACHE_TTL;

		private int cacheMaxEntries = FilterConfig.DEFAULT_CACHE_MAX_ENTRIES;

		private boolean logBlockedContent = true;

		private boolean logPiiRedactions = true;

		private boolean logResponseSummaries = true;

		public Map<String, Boolean> getToggles() {
			return this.toggles;
		}

		public void setToggles(Map<String, Boolean> toggles) {
			this.toggles = toggles;
		}

		public List<String> getBlockedDomains() {
			return this.blockedDomains;
		}

		public void setBlockedDomains(List<String> blockedDomains) {
			this.blockedDomains = blockedDomains;
		}

		public List<String> getBlockedKeywords() {
			return this.blockedKeywords;
		}

		public void setBlockedKeywords(List<String> blockedKeywords) {
			this.blockedKeywords = blockedKeywords;
		}

		public List<String> getBlockedPatterns() {
			return this.blockedPatterns;
		}

		public void setBlockedPatterns(List<String> blockedPatterns) {
			this.blockedPatterns = blockedPatterns;
		}

		public boolean isRemoveScripts() {
			return this.removeScripts;
		}

		public void setRemoveScripts(boolean removeScripts) {
			this.removeScripts = removeScripts;
		}

		public boolean isRemoveTracking() {
			return this.removeTracking;
		}

		public void setRemoveTracking(boolean removeTracking) {
			this.removeTracking = removeTracking;
		}

		public boolean isRemoveAds() {
			return this.removeAds;
		}

		public void setRemoveAds(boolean removeAds) {
			this.removeAds = removeAds;
		}

		public boolean isNormalizeWhitespace() {
			return this.normalizeWhitespace;
		}

		public void setNormalizeWhitespace(boolean normalizeWhitespace) {
			this.normalizeWhitespace = normalizeWhitespace;
		}

		public boolean isRedactEmails() {
			return this.redactEmails;
		}

		public void setRedactEmails(boolean redactEmails) {
			this.redactEmails = redactEmails;
		}

		public boolean isRedactPhones() {
			return this.redactPhones;
		}

		public void setRedactPhones(boolean redactPhones) {
			this.redactPhones = redactPhones;
		}

		public boolean isRedactSsns() {
			return this.redactSsns;
		}

		public void setRedactSsns(boolean redactSsns) {
			this.redactSsns = redactSsns;
		}

		public boolean isRedactCreditCards() {
			return this.redactCreditCards;
		}

		public void setRedactCreditCards(boolean redactCreditCards) {
			this.redactCreditCards = redactCreditCards;
		}

		public int getMaxResponseLength() {
			return this.maxResponseLength;
		}

		public void setMaxResponseLength(int maxResponseLength) {
			this.maxResponseLength = maxResponseLength;
		}

		public int getSummarizeThreshold() {
			return this.summarizeThreshold;
		}

		public void setSummarizeThreshold(int summarizeThreshold) {
			this.summarizeThreshold = summarizeThreshold;
		}

		public boolean isEnableCaching() {
			return this.enableCaching;
		}

		public void setEnableCaching(boolean enableCaching) {
			this.enableCaching = enableCaching;
		}

		public Duration getCacheTtl() {
			return this.cacheTtl;
		}

		public void setCacheTtl(Duration cacheTtl) {
			this.cacheTtl = cacheTtl;
		}

		public int getCacheMaxEntries() {
			return this.cacheMaxEntries;
		}

		public void setCacheMaxEntries(int cacheMaxEntries) {
			this.cacheMaxEntries = cacheMaxEntries;
		}

		public boolean isLogBlockedContent() {
			return this.logBlockedContent;
		}

		public void setLogBlockedContent(boolean logBlockedContent) {
			this.logBlockedContent = logBlockedContent;
		}

		public boolean isLogPiiRedactions() {
			return this.logPiiRedactions;
		}

		public void setLogPiiRedactions(boolean logPiiRedactions) {
			this.logPiiRedactions = logPiiRedactions;
		}

		public boolean isLogResponseSummaries() {
			return this.logResponseSummaries;
		}

		public void setLogResponseSummaries(boolean logResponseSummaries) {
			this.logResponseSummaries = logResponseSummaries;
		}

		/**
		 * Build the initial filter configuration snapshot.
		 * @return configuration at version 0
		 */
		public FilterConfig toFilterConfig() {
			return FilterConfig.builder()
				.filterToggles(this.toggles)
				.blockedDomains(this.blockedDomains)
				.blockedKeywords(this.blockedKeywords)
				.blockedPatterns(this.blockedPatterns)
				.removeScripts(this.removeScripts)
				.removeTracking(this.removeTracking)
				.removeAds(this.removeAds)
				.normalizeWhitespace(this.normalizeWhitespace)
				.redactEmails(this.redactEmails)
				.redactPhones(this.redactPhones)
				.redactSsns(this.redactSsns)
				.redactCreditCards(this.redactCreditCards)
				.maxResponseLength(this.maxResponseLength)
				.summarizeThreshold(this.summarizeThreshold)
				.enableCaching(this.enableCaching)
				.cacheTtl(this.cacheTtl)
				.cacheMaxEntries(this.cacheMaxEntries)
				.logBlockedContent(this.logBlockedContent)
				.logPiiRedactions(this.logPiiRedactions)
				.logResponseSummaries(this.logResponseSummaries)
				.build();
		}

	}

}
