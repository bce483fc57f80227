package com.gaussjordan;

public enum SolutionType { NO_SOLUTION, UNIQUE, INFINITE, NOT_APPLICABLE }
