package com.example.chatrelay.service;

/**
 * Fixed user-facing texts. Users are addressed in French.
 */
public final class ReplyTemplates {

    public static final String MISSING_INPUT = "Missing user_id or message";

    public static final String AUDIO_INSTRUCTION =
            "Listen to this audio. Search knowledge base and respond in French using 'vous'.";

    public static final String MEDIA_FETCH_FAILED =
            "Désolé, je n'ai pas pu récupérer l'audio. Réessayez plus tard.";
    public static final String AUDIO_AGENT_FAILED =
            "Désolé, une erreur est survenue avec le traitement audio. Réessayez plus tard.";
    public static final String TEXT_AGENT_FAILED =
            "Désolé, une erreur est survenue. Réessayez dans un instant.";
    public static final String CHAT_AGENT_FAILED =
            "Désolé, une erreur est survenue en traitant votre demande. Réessayez dans un instant.";
    public static final String UNEXPECTED =
            "Désolé, une erreur inattendue est survenue.";

    private ReplyTemplates() {
    }
}
