package com.williamcallahan.videochat.support;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Token-bounded prompt assembly using the {@code cl100k_base} encoding as an estimate.
 */
@Component
public class PromptTokenBudget {

    private final Encoding encoding;

    public PromptTokenBudget() {
        EncodingRegistry registry = Encodings.newDefaultEncodingRegistry();
        this.encoding = registry.getEncoding(EncodingType.CL100K_BASE);
    }

    public int countTokens(String text) {
        return text == null || text.isEmpty() ? 0 : encoding.countTokens(text);
    }

    /**
     * Keeps leading blocks while their running token total stays within budget.
     *
     * @param blocks prompt blocks in priority order
     * @param maxTokens budget, non-positive for unlimited
     * @return the longest prefix of {@code blocks} that fits; the first block is always kept
     */
    public List<String> leadingBlocksWithin(List<String> blocks, int maxTokens) {
        if (maxTokens <= 0) {
            return List.copyOf(blocks);
        }
        List<String> kept = new ArrayList<>();
        int used = 0;
        for (String block : blocks) {
            int cost = countTokens(block);
            if (!kept.isEmpty() && used + cost > maxTokens) {
                break;
            }
            kept.add(block);
            used += cost;
        }
        return List.copyOf(kept);
    }
}
