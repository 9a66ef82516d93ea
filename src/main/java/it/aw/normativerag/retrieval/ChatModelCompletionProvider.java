package it.aw.normativerag.retrieval;

import dev.langchain4j.model.chat.ChatLanguageModel;

/**
 * {@link CompletionProvider} su un {@link ChatLanguageModel} LangChain4j.
 */
public class ChatModelCompletionProvider implements CompletionProvider {

    private final String id;
    private final ChatLanguageModel model;

    public ChatModelCompletionProvider(String id, ChatLanguageModel model) {
        this.id = id;
        this.model = model;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String complete(String prompt) {
        return model.generate(prompt);
    }
}
