package com.delta.jobfeed.sync.remote;

import com.delta.jobfeed.config.FeedSyncProperties;
import com.delta.jobfeed.sync.http.AtsHttpClient;
import com.delta.jobfeed.sync.model.CollectionFetchResult;
import com.delta.jobfeed.sync.model.CrossCheckOutcome;
import com.delta.jobfeed.sync.model.HttpFetchResult;
import com.delta.jobfeed.sync.model.JobRecord;
import com.delta.jobfeed.sync.model.RemoteSession;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Retrieves the active job records of a tearsheet. The remote system answers "which jobs belong to this
 * tearsheet" through two surfaces that often disagree: the entity association (cheap, ids only after the
 * first page) and the search index (paginated, full fields). {@link #fetchCollection(long)} cross-checks
 * them and never removes records on the strength of a count it could not verify.
 */
@Service
public class RemoteSourceClient {
    private static final Logger log = LoggerFactory.getLogger(RemoteSourceClient.class);

    static final String JOB_FIELDS = "id,title,publicDescription,description,status,isOpen,isDeleted,"
        + "employmentType,onSite,address,assignedUsers(firstName,lastName),responseUser(firstName,lastName),"
        + "owner(firstName,lastName),dateAdded,dateLastModified";

    private final AtsHttpClient httpClient;
    private final BullhornAuthenticator authenticator;
    private final JobRecordMapper mapper;
    private final ObjectMapper objectMapper;
    private final FeedSyncProperties properties;
    private final Set<String> excludedIds = new LinkedHashSet<>();
    private volatile RemoteSession session;

    public RemoteSourceClient(
        AtsHttpClient httpClient,
        BullhornAuthenticator authenticator,
        JobRecordMapper mapper,
        ObjectMapper objectMapper,
        FeedSyncProperties properties
    ) {
        this.httpClient = httpClient;
        this.authenticator = authenticator;
        this.mapper = mapper;
        this.objectMapper = objectMapper;
        this.properties = properties;
        for (String id : properties.getRemote().getExcludedIds()) {
            if (id != null && !id.isBlank()) {
                excludedIds.add(id.trim());
            }
        }
    }

    /**
     * Drops the cached REST session so the next fetch authenticates again.
     */
    public void invalidateSession() {
        session = null;
    }

    /**
     * Fetches the active, deduplicated, exclusion-filtered records of one collection. Page failures end
     * pagination early and yield a partial result; only authentication failures propagate.
     *
     * @throws RemoteAuthException when no REST session can be established
     */
    public CollectionFetchResult fetchCollection(long collectionId) {
        RemoteSession current = session();
        Map<String, Integer> errors = new LinkedHashMap<>();
        FeedSyncProperties.Remote remote = properties.getRemote();

        AssociationPage association;
        try {
            association = fetchAssociationFirstPage(current, collectionId);
        } catch (TransientFetchException e) {
            log.warn("Association query failed for collection {}: {}", collectionId, e.getMessage());
            increment(errors, "association_failed");
            association = null;
        }

        List<JsonNode> items;
        boolean partial = false;
        int searchTotal = -1;
        CrossCheckOutcome crossCheck;
        Set<String> orphaned = new LinkedHashSet<>();

        if (association != null && association.total() <= remote.getSmallCollectionThreshold()) {
            items = association.members();
            partial = items.size() < association.total();
            crossCheck = CrossCheckOutcome.ASSOCIATION_TRUSTED;
        } else {
            Set<String> associationIds = null;
            if (association != null) {
                try {
                    associationIds = collectAssociationIds(current, collectionId, association, errors);
                } catch (PaginationInconsistencyException e) {
                    log.warn("{}; cross-check aborted and removals disabled for this collection", e.getMessage());
                    increment(errors, "pagination_inconsistency");
                }
            }
            SearchResult search = fetchSearch(current, collectionId, errors);
            items = search.items();
            partial = search.partial();
            searchTotal = search.total();

            if (associationIds == null) {
                crossCheck = CrossCheckOutcome.ABORTED;
            } else if (association.total() < items.size()) {
                crossCheck = CrossCheckOutcome.ASSOCIATION_AUTHORITATIVE;
                List<JsonNode> members = new ArrayList<>();
                for (JsonNode item : items) {
                    String id = item.path("id").asText("");
                    if (associationIds.contains(id)) {
                        members.add(item);
                    } else {
                        orphaned.add(id);
                    }
                }
                items = members;
                log.info(
                    "Collection {}: association total {} below search count {}; {} orphaned by association total: {}",
                    collectionId,
                    association.total(),
                    search.items().size(),
                    orphaned.size(),
                    orphaned
                );
            } else if (association.total() > items.size()) {
                crossCheck = CrossCheckOutcome.SEARCH_AUTHORITATIVE;
                log.info(
                    "Collection {}: association total {} above search count {}; keeping search results",
                    collectionId,
                    association.total(),
                    items.size()
                );
            } else {
                crossCheck = CrossCheckOutcome.CONSISTENT;
            }
        }

        List<JobRecord> records = toActiveRecords(collectionId, items, errors);
        int associationTotal = association == null ? -1 : association.total();
        log.info(
            "Collection {}: {} active records (association={}, search={}, crossCheck={}, partial={})",
            collectionId,
            records.size(),
            associationTotal,
            searchTotal,
            crossCheck,
            partial
        );
        return new CollectionFetchResult(
            collectionId,
            records,
            associationTotal,
            searchTotal,
            crossCheck,
            orphaned,
            partial,
            errors
        );
    }

    private RemoteSession session() {
        RemoteSession current = session;
        if (current == null) {
            current = authenticator.authenticate();
            session = current;
        }
        return current;
    }

    private AssociationPage fetchAssociationFirstPage(RemoteSession current, long collectionId) {
        String url = current.endpoint("entity/Tearsheet/" + collectionId)
            + "?fields=" + encode("id,jobOrders(" + JOB_FIELDS + ")")
            + "&BhRestToken=" + encode(current.restToken());
        JsonNode jobOrders = requestJson(url, "association query").path("data").path("jobOrders");
        List<JsonNode> members = new ArrayList<>();
        for (JsonNode member : jobOrders.path("data")) {
            members.add(member);
        }
        int total = jobOrders.path("total").asInt(members.size());
        return new AssociationPage(total, members);
    }

    private Set<String> collectAssociationIds(
        RemoteSession current,
        long collectionId,
        AssociationPage firstPage,
        Map<String, Integer> errors
    ) {
        int pageSize = properties.getRemote().getAssociationPageSize();
        Set<String> ids = new LinkedHashSet<>();
        for (JsonNode member : firstPage.members()) {
            String id = member.path("id").asText("");
            if (!id.isBlank()) {
                ids.add(id);
            }
        }
        int start = firstPage.members().size();
        int pages = 0;
        while (ids.size() < firstPage.total() && pages < properties.getRemote().getMaxPages()) {
            String url = current.endpoint("entity/Tearsheet/" + collectionId + "/jobOrders")
                + "?fields=id&start=" + start + "&count=" + pageSize
                + "&BhRestToken=" + encode(current.restToken());
            JsonNode page;
            try {
                page = requestJson(url, "association page");
            } catch (TransientFetchException e) {
                log.warn("Association page at {} failed for collection {}: {}", start, collectionId, e.getMessage());
                increment(errors, "association_page_failed");
                break;
            }
            pages++;
            JsonNode data = page.path("data");
            if (!data.isArray() || data.isEmpty()) {
                break;
            }
            for (JsonNode member : data) {
                String id = member.path("id").asText("");
                if (!id.isBlank()) {
                    ids.add(id);
                }
            }
            if (data.size() < pageSize) {
                break;
            }
            start += data.size();
        }
        if (ids.size() < firstPage.total()) {
            throw new PaginationInconsistencyException(collectionId, ids.size(), firstPage.total());
        }
        return ids;
    }

    private SearchResult fetchSearch(RemoteSession current, long collectionId, Map<String, Integer> errors) {
        int pageSize = properties.getRemote().getSearchPageSize();
        int maxPages = properties.getRemote().getMaxPages();
        List<JsonNode> items = new ArrayList<>();
        int total = -1;
        int start = 0;
        int pages = 0;
        boolean partial = false;
        boolean exhausted = false;
        while (pages < maxPages) {
            String url = current.endpoint("search/JobOrder")
                + "?query=" + encode("tearsheets.id:" + collectionId)
                + "&fields=" + encode(JOB_FIELDS)
                + "&sort=-dateLastModified"
                + "&start=" + start
                + "&count=" + pageSize
                + "&BhRestToken=" + encode(current.restToken());
            JsonNode page;
            try {
                page = requestJson(url, "search page");
            } catch (TransientFetchException e) {
                log.warn("Search page at {} failed for collection {}: {}", start, collectionId, e.getMessage());
                increment(errors, "search_page_failed");
                partial = true;
                break;
            }
            pages++;
            total = page.path("total").asInt(total);
            JsonNode data = page.path("data");
            int received = data.isArray() ? data.size() : 0;
            for (int i = 0; i < received; i++) {
                items.add(data.get(i));
            }
            start += received;
            if (received < pageSize || (total >= 0 && start >= total)) {
                exhausted = true;
                break;
            }
        }
        if (!partial && !exhausted) {
            log.warn("Search for collection {} stopped at the {} page cap with {} of {} records", collectionId, maxPages, items.size(), total);
            increment(errors, "search_page_cap");
            partial = true;
        }
        return new SearchResult(total, items, partial);
    }

    private List<JobRecord> toActiveRecords(long collectionId, List<JsonNode> items, Map<String, Integer> errors) {
        Map<String, JobRecord> byId = new LinkedHashMap<>();
        int inactive = 0;
        int excluded = 0;
        for (JsonNode item : items) {
            Optional<JobRecord> mapped = mapper.map(item, collectionId);
            if (mapped.isEmpty()) {
                increment(errors, "record_missing_id");
                continue;
            }
            JobRecord record = mapped.get();
            if (excludedIds.contains(record.externalId())) {
                excluded++;
                continue;
            }
            if (!record.active()) {
                inactive++;
                continue;
            }
            byId.putIfAbsent(record.externalId(), record);
        }
        if (inactive > 0 || excluded > 0) {
            log.debug("Collection {}: skipped {} inactive and {} excluded records", collectionId, inactive, excluded);
        }
        return new ArrayList<>(byId.values());
    }

    private JsonNode requestJson(String url, String context) {
        HttpFetchResult result = httpClient.get(url, "application/json");
        if (!result.isSuccessful() || result.body() == null) {
            throw new TransientFetchException(context + " failed: " + result.describeFailure());
        }
        try {
            return objectMapper.readTree(result.body());
        } catch (JsonProcessingException e) {
            throw new TransientFetchException(context + " returned malformed JSON", e);
        }
    }

    private String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private void increment(Map<String, Integer> errors, String key) {
        errors.merge(key, 1, Integer::sum);
    }

    private record AssociationPage(int total, List<JsonNode> members) {
    }

    private record SearchResult(int total, List<JsonNode> items, boolean partial) {
    }
}
