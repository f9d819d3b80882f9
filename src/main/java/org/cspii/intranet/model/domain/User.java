package org.cspii.intranet.model.domain;

import lombok.Getter;
import lombok.Setter;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A person in the directory.
 *
 * The uid is the identity; team membership is owned by the directory and only
 * mirrored here when the user was read back from it.
 */
@Getter
@Setter
public class User {

    private final String uid;
    private String givenName;
    private String surname;
    private String mail;

    // Set when the entry was read from (or written to) the directory
    private String distinguishedName;

    private Set<String> teams = new LinkedHashSet<>();

    public User(String uid, String givenName, String surname) {
        this.uid = Objects.requireNonNull(uid, "uid");
        this.givenName = givenName;
        this.surname = surname;
    }

    public boolean isMaterialized() {
        return distinguishedName != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        User user = (User) o;
        return uid.equals(user.uid);
    }

    @Override
    public int hashCode() {
        return uid.hashCode();
    }

    @Override
    public String toString() {
        return "User{" +
                "uid='" + uid + '\'' +
                ", givenName='" + givenName + '\'' +
                ", surname='" + surname + '\'' +
                ", mail='" + mail + '\'' +
                ", teams=" + teams +
                '}';
    }
}
