package com.gaussjordan;

public enum RunState { NOT_STARTED, IN_PROGRESS, FINISHED }
