package org.pokerroom.model.poker;

public enum SeatStatus { EMPTY, OCCUPIED }
