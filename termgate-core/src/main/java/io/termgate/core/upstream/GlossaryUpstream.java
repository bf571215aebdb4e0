package io.termgate.core.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.termgate.core.tool.GlossaryTool;
import io.termgate.core.tool.ToolDescriptor;
import io.termgate.core.validation.ToolArguments;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class GlossaryUpstream {
    private static final Logger LOG = LoggerFactory.getLogger(GlossaryUpstream.class);
    private static final Set<Integer> LISTING_FALLBACK_STATUSES = Set.of(404, 405, 501);
    static final String DEFINITIONS_PREAMBLE = "Provide glossary definitions for the following terms:";

    private final UpstreamClient client;
    private final ObjectMapper mapper;
    private final double similarityThreshold;
    private final double vectorSimilarityWeight;

    public GlossaryUpstream(UpstreamClient client, double similarityThreshold, double vectorSimilarityWeight) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.mapper = new ObjectMapper();
        this.similarityThreshold = similarityThreshold;
        this.vectorSimilarityWeight = vectorSimilarityWeight;
    }

    public String execute(ToolDescriptor tool, ToolArguments arguments, String correlationId, long deadlineNanos)
        throws UpstreamException {
        return switch (tool.operation()) {
            case LIST_GLOSSARIES -> client.call(listRequest(arguments.nameFilter()), correlationId, deadlineNanos).body();
            case GET_GLOSSARY -> fetchGlossary(arguments.datasetId(), correlationId, deadlineNanos);
            case RETRIEVE -> client.call(retrieveRequest(tool.tool(), arguments), correlationId, deadlineNanos).body();
        };
    }

    UpstreamRequest retrieveRequest(GlossaryTool tool, ToolArguments arguments) {
        boolean keyword = false;
        boolean highlight = true;
        String question = arguments.query();
        switch (tool) {
            case RETRIEVE_DOCS -> {
                keyword = arguments.keyword();
                highlight = arguments.highlight();
            }
            case RETRIEVE_DEFINITIONS -> question = definitionsQuestion(arguments.terms());
            default -> {
            }
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("question", question);
        body.put("top_k", arguments.topK());
        body.put("similarity_threshold", similarityThreshold);
        body.put("vector_similarity_weight", vectorSimilarityWeight);
        body.put("keyword", keyword);
        body.put("highlight", highlight);
        return UpstreamRequest.post("/glossaries/" + arguments.datasetId() + "/retrieve", body);
    }

    static String definitionsQuestion(List<String> terms) {
        StringBuilder question = new StringBuilder(DEFINITIONS_PREAMBLE);
        for (String term : terms) {
            question.append("\n- ").append(term);
        }
        return question.toString();
    }

    private UpstreamRequest listRequest(String nameFilter) {
        return UpstreamRequest.get("/glossaries", nameFilter == null ? Map.of() : Map.of("name", nameFilter));
    }

    private String fetchGlossary(String datasetId, String correlationId, long deadlineNanos) throws UpstreamException {
        try {
            return client.call(UpstreamRequest.get("/glossaries/" + datasetId, Map.of()), correlationId, deadlineNanos).body();
        } catch (UpstreamException e) {
            if (e.kind() != UpstreamException.Kind.HTTP_STATUS || !LISTING_FALLBACK_STATUSES.contains(e.statusCode())) {
                throw e;
            }
            LOG.debug("Direct glossary fetch returned status {}, falling back to list (request_id={})", e.statusCode(), correlationId);
        }

        String listing = client.call(listRequest(null), correlationId, deadlineNanos).body();
        JsonNode items;
        try {
            items = mapper.readTree(listing).path("items");
        } catch (IOException e) {
            throw new UpstreamException(UpstreamException.Kind.MALFORMED_PAYLOAD, 200, "Invalid JSON received from upstream service", 1, e);
        }
        for (JsonNode item : items) {
            String identifier = item.hasNonNull("dataset_id") ? item.get("dataset_id").asText() : item.path("id").asText(null);
            if (datasetId.equals(identifier)) {
                return item.toString();
            }
        }
        throw UpstreamException.httpStatus(404, "Glossary '" + datasetId + "' was not found", 1);
    }
}
