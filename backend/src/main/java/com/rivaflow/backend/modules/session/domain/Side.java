package com.rivaflow.backend.modules.session.domain;

/**
 * Which submission set of a roll a movement is tagged into.
 */
public enum Side {
    FOR,
    AGAINST
}
