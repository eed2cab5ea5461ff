package me.binarii.mirror.core;

import me.binarii.mirror.model.Protocol;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

public class FilterCriteria {

    private static final FilterCriteria NONE = builder().build();

    private final Double maxAgeHours;

    private final boolean isos;

    private final boolean ipv4;

    private final boolean ipv6;

    private final Set<Protocol> protocols;

    private FilterCriteria(Builder builder) {
        this.maxAgeHours = builder.maxAgeHours;
        this.isos = builder.isos;
        this.ipv4 = builder.ipv4;
        this.ipv6 = builder.ipv6;
        this.protocols = builder.protocols.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(builder.protocols));
    }

    public static FilterCriteria none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Double getMaxAgeHours() {
        return maxAgeHours;
    }

    public boolean isIsos() {
        return isos;
    }

    public boolean isIpv4() {
        return ipv4;
    }

    public boolean isIpv6() {
        return ipv6;
    }

    public Set<Protocol> getProtocols() {
        return protocols;
    }

    @Override
    public String toString() {
        return "FilterCriteria(age<" + maxAgeHours + "h, isos=" + isos + ", ipv4=" + ipv4
                + ", ipv6=" + ipv6 + ", protocols=" + protocols + ")";
    }

    public static class Builder {

        private Double maxAgeHours;

        private boolean isos;

        private boolean ipv4;

        private boolean ipv6;

        private final Set<Protocol> protocols = EnumSet.noneOf(Protocol.class);

        public Builder maxAgeHours(Double maxAgeHours) {
            if (maxAgeHours != null && maxAgeHours.isNaN()) {
                throw new IllegalArgumentException("age cutoff must be a number");
            }
            this.maxAgeHours = maxAgeHours;
            return this;
        }

        public Builder isos(boolean isos) {
            this.isos = isos;
            return this;
        }

        public Builder ipv4(boolean ipv4) {
            this.ipv4 = ipv4;
            return this;
        }

        public Builder ipv6(boolean ipv6) {
            this.ipv6 = ipv6;
            return this;
        }

        public Builder protocols(Collection<Protocol> protocols) {
            this.protocols.clear();
            this.protocols.addAll(protocols);
            return this;
        }

        public FilterCriteria build() {
            return new FilterCriteria(this);
        }

    }

}
