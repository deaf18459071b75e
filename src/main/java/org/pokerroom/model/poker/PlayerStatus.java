package org.pokerroom.model.poker;

public enum PlayerStatus { WAITING, ACTIVE, FOLDED, ALL_IN, SITTING_OUT, DISCONNECTED }
