package com.xammer.orgtree.cli;

import com.xammer.orgtree.domain.AccountFilter;
import picocli.CommandLine;

public class AccountFilterConverter implements CommandLine.ITypeConverter<AccountFilter> {

    @Override
    public AccountFilter convert(String value) {
        try {
            return AccountFilter.fromLabel(value);
        } catch (IllegalArgumentException e) {
            throw new CommandLine.TypeConversionException(e.getMessage());
        }
    }
}
