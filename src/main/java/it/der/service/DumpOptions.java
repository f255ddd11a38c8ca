package it.der.service;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class DumpOptions {

    private int indent = 2;
    private int hexPreviewBytes = 16;
    private boolean resolveOidNames = true;
}
