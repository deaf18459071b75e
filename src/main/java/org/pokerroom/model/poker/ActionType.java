package org.pokerroom.model.poker;

public enum ActionType { FOLD, CHECK, CALL, BET, RAISE, ALL_IN }
