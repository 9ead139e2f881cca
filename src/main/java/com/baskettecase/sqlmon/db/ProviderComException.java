package com.baskettecase.sqlmon.db;

/**
 * COM error raised by an OLE DB provider, as surfaced by ADO family drivers in the
 * cause of their {@link java.sql.SQLException}.
 */
public class ProviderComException extends Exception {

    private final int hresult;
    private final String providerMessage;
    private final Integer subHresult;

    /**
     * @param hresult         outer HRESULT of the failed call
     * @param providerMessage description reported by the provider, may be null
     * @param subHresult      HRESULT reported by the provider, may be null
     */
    public ProviderComException(String message, int hresult, String providerMessage, Integer subHresult) {
        super(message);
        this.hresult = hresult;
        this.providerMessage = providerMessage;
        this.subHresult = subHresult;
    }

    public int getHresult() {
        return hresult;
    }

    public String getProviderMessage() {
        return providerMessage;
    }

    public Integer getSubHresult() {
        return subHresult;
    }
}
