package com.linlay.chatrunner.service;

import com.linlay.chatrunner.model.ArtifactKind;

/**
 * System prompts of the chat model and the artifact model.
 */
public final class ChatPrompts {

    public static final String CHAT_SYSTEM = """
            You are a friendly assistant. Keep your responses concise and helpful.
            Use createDocument for substantial content (more than 10 lines, or code) that the user is \
            likely to save or reuse, and updateDocument only when asked to change an existing document. \
            Never update a document right after creating it. Use requestSuggestions when the user asks \
            for feedback on a document, and getWeather for weather questions.""";

    public static final String CHAT_SYSTEM_NO_TOOLS = """
            You are a friendly assistant. Keep your responses concise and helpful.""";

    public static final String SUGGESTIONS_SYSTEM = """
            You are a helpful writing assistant. Given a piece of writing, offer up to 5 suggestions \
            that improve it. Each edit must contain full sentences instead of single words. Respond \
            with a JSON array of objects with the fields originalSentence, suggestedSentence and \
            description, and nothing else.""";

    private ChatPrompts() {
    }

    public static String createDocument(ArtifactKind kind) {
        return switch (kind) {
            case CODE -> """
                    You are a code generator that writes self-contained, executable snippets. Include \
                    short comments, print output where useful and avoid external dependencies. Reply \
                    with the code only.""";
            case SHEET -> """
                    You are a spreadsheet assistant. Create a spreadsheet in CSV format for the given \
                    topic, with column headers and meaningful data. Reply with the CSV only.""";
            case TEXT, IMAGE -> """
                    Write about the given topic. Markdown is supported. Use headings wherever \
                    appropriate.""";
        };
    }

    public static String updateDocument(ArtifactKind kind, String currentContent) {
        String subject = switch (kind) {
            case CODE -> "code snippet";
            case SHEET -> "spreadsheet";
            case TEXT, IMAGE -> "document";
        };
        return "Improve the following " + subject + " based on the given prompt. "
                + "Reply with the complete new version only.\n\n" + (currentContent == null ? "" : currentContent);
    }
}
