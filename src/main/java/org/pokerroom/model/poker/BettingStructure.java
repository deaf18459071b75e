package org.pokerroom.model.poker;

public enum BettingStructure { NO_LIMIT, POT_LIMIT, FIXED_LIMIT }
