package com.rizilab.averroes.bridge.domain;

/**
 * Kind of question a client can put to the advisory core.
 */
public enum QueryKind {
    TOKEN,
    TEXT,
    CONTRACT,
    AUDIO,
    CHAT_MESSAGE
}
