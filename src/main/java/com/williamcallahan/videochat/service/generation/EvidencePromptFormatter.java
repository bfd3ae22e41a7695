package com.williamcallahan.videochat.service.generation;

import com.williamcallahan.videochat.domain.EvidenceItem;
import com.williamcallahan.videochat.domain.SourceCitation;
import com.williamcallahan.videochat.support.TimestampFormatter;
import java.util.ArrayList;
import java.util.List;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.MessageType;
import org.springframework.stereotype.Component;

/**
 * Renders numbered evidence and conversation history into prompt text.
 *
 * <p>Evidence is numbered {@code [1..N]} in rank order; generated citation markers refer to this
 * numbering, and {@link #citations(List)} uses the same order.</p>
 */
@Component
public class EvidencePromptFormatter {

    private static final String ITEM_SEPARATOR = "\n\n";

    /**
     * Formats evidence as {@code [n] Video: {title} (MM:SS-MM:SS)} followed by the chunk text.
     */
    public String formatEvidence(List<EvidenceItem> evidence) {
        List<String> blocks = new ArrayList<>(evidence.size());
        for (int position = 0; position < evidence.size(); position++) {
            EvidenceItem item = evidence.get(position);
            blocks.add("[" + (position + 1) + "] Video: " + item.videoTitle()
                    + " (" + TimestampFormatter.minutesSeconds(item.startTime())
                    + "-" + TimestampFormatter.minutesSeconds(item.endTime()) + ")\n"
                    + item.text());
        }
        return String.join(ITEM_SEPARATOR, blocks);
    }

    public List<SourceCitation> citations(List<EvidenceItem> evidence) {
        List<SourceCitation> citations = new ArrayList<>(evidence.size());
        for (int position = 0; position < evidence.size(); position++) {
            citations.add(evidence.get(position).toCitation(position + 1));
        }
        return List.copyOf(citations);
    }

    public String formatHistory(List<Message> history) {
        if (history.isEmpty()) {
            return "(no earlier messages)";
        }
        List<String> lines = new ArrayList<>(history.size());
        for (Message message : history) {
            String speaker = message.getMessageType() == MessageType.ASSISTANT ? "Assistant" : "User";
            lines.add(speaker + ": " + message.getText());
        }
        return String.join(ITEM_SEPARATOR, lines);
    }

    public String questionPrompt(String question, List<EvidenceItem> evidence) {
        return PromptTemplates.QA_USER_TEMPLATE.formatted(formatEvidence(evidence), question);
    }

    public String followUpPrompt(String question, List<EvidenceItem> evidence, List<Message> history) {
        return PromptTemplates.FOLLOWUP_USER_TEMPLATE.formatted(
                formatHistory(history), formatEvidence(evidence), question);
    }
}
