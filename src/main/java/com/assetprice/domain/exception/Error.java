package com.assetprice.domain.exception;

/**
 * Error code carried by {@link ServiceException}
 */
public record Error(String code) {
}
