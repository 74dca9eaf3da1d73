package com.ryuqq.catalog.core.types;

import com.ryuqq.catalog.core.validation.ValidatorPipeline;
import com.ryuqq.catalog.core.validation.Validators;

/**
 * 기본 제공 리소스 타입.
 *
 * <p>{@link #registry()}는 호출할 때마다 새 레지스트리를 만듭니다. 프로세스 시작 시 한 번
 * 생성해 {@code CompilationContext}에 넣어 공유합니다.</p>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public final class NativeTypes {

    private NativeTypes() {
    }

    /**
     * 기본 타입이 모두 등록된 레지스트리.
     *
     * @return TypeRegistry
     */
    public static TypeRegistry registry() {
        return TypeRegistry.builder()
            .register("file", file())
            .register("package", packageType())
            .register("service", service())
            .register("user", user())
            .register("group", group())
            .register("host", host())
            .register("exec", exec())
            .register("cron", cron())
            .register("mount", mount())
            .register("notify", notifyType())
            .register("ssh_authorized_key", sshAuthorizedKey())
            .register("concat", ValidatorPipeline.acceptAll())
            .register("concat::fragment", ValidatorPipeline.acceptAll())
            .register("anchor", ValidatorPipeline.passthrough())
            .build();
    }

    static ValidatorPipeline file() {
        return ValidatorPipeline.builder()
            .parameter("path", Validators::nameval, Validators::fullyQualified, Validators::noTrailingSlash)
            .parameter("ensure", Validators::string, Validators.values("present", "absent", "file", "directory", "link"))
            .parameter("content", Validators::string)
            .parameter("source", Validators::rarray, Validators::strings)
            .parameter("owner", Validators::string)
            .parameter("group", Validators::string)
            .parameter("mode", Validators::string)
            .parameter("target", Validators::string)
            .parameter("recurse", Validators::string, Validators.values("true", "false", "inf", "remote"))
            .parameter("recurselimit", Validators::integer)
            .parameter("purge", Validators::string, Validators.values("true", "false"))
            .parameter("force", Validators::string, Validators.values("true", "false"))
            .parameter("replace", Validators::string, Validators.values("true", "false", "yes", "no"))
            .parameter("links", Validators::string, Validators.values("follow", "manage"))
            .parameter("backup", Validators::string)
            .parameter("checksum", Validators::string, Validators.values("md5", "md5lite", "sha256", "mtime", "ctime", "none"))
            .parameter("ignore", Validators::rarray, Validators::strings)
            .parameter("seltype", Validators::string)
            .parameter("seluser", Validators::string)
            .parameter("selrole", Validators::string)
            .parameter("selrange", Validators::string)
            .validate(Validators.sourceOrContent())
            .build();
    }

    static ValidatorPipeline packageType() {
        return ValidatorPipeline.builder()
            .parameter("name", Validators::nameval)
            .parameter("ensure", Validators.defaultValue("installed"), Validators::string)
            .parameter("provider", Validators::string)
            .parameter("source", Validators::string)
            .parameter("responsefile", Validators::string, Validators::fullyQualified)
            .parameter("adminfile", Validators::string, Validators::fullyQualified)
            .parameter("install_options", Validators::rarray)
            .parameter("uninstall_options", Validators::rarray)
            .parameter("configfiles", Validators::string, Validators.values("keep", "replace"))
            .parameter("allow_virtual", Validators::string, Validators.values("true", "false"))
            .build();
    }

    static ValidatorPipeline service() {
        return ValidatorPipeline.builder()
            .parameter("name", Validators::nameval)
            .parameter("ensure", Validators::string, Validators.values("stopped", "running", "true", "false"))
            .parameter("enable", Validators::string, Validators.values("true", "false", "manual", "mask"))
            .parameter("hasstatus", Validators::string, Validators.values("true", "false"))
            .parameter("hasrestart", Validators::string, Validators.values("true", "false"))
            .parameter("binary", Validators::string)
            .parameter("control", Validators::string)
            .parameter("path", Validators::rarray, Validators::fullyQualifieds)
            .parameter("pattern", Validators::string)
            .parameter("provider", Validators::string)
            .parameter("restart", Validators::string)
            .parameter("start", Validators::string)
            .parameter("status", Validators::string)
            .parameter("stop", Validators::string)
            .parameter("manifest", Validators::string)
            .build();
    }

    static ValidatorPipeline user() {
        return ValidatorPipeline.builder()
            .parameter("name", Validators::nameval)
            .parameter("ensure", Validators::string, Validators.values("present", "absent", "role"))
            .parameter("uid", Validators::integer, Validators.inRange(0, 4294967295L))
            .parameter("gid", Validators::string)
            .parameter("groups", Validators::rarray, Validators::strings)
            .parameter("comment", Validators::string)
            .parameter("home", Validators::string, Validators::fullyQualified)
            .parameter("shell", Validators::string, Validators::fullyQualified)
            .parameter("password", Validators::string)
            .parameter("managehome", Validators::string, Validators.values("true", "false"))
            .parameter("system", Validators::string, Validators.values("true", "false"))
            .parameter("expiry", Validators::string)
            .parameter("membership", Validators::string, Validators.values("inclusive", "minimum"))
            .parameter("purge_ssh_keys", Validators::string)
            .parameter("allowdupe", Validators::string, Validators.values("true", "false"))
            .parameter("provider", Validators::string)
            .build();
    }

    static ValidatorPipeline group() {
        return ValidatorPipeline.builder()
            .parameter("name", Validators::nameval)
            .parameter("ensure", Validators::string, Validators.values("present", "absent"))
            .parameter("gid", Validators::integer, Validators.inRange(0, 4294967295L))
            .parameter("members", Validators::rarray, Validators::strings)
            .parameter("auth_membership", Validators::string, Validators.values("true", "false"))
            .parameter("system", Validators::string, Validators.values("true", "false"))
            .parameter("allowdupe", Validators::string, Validators.values("true", "false"))
            .parameter("provider", Validators::string)
            .build();
    }

    static ValidatorPipeline host() {
        return ValidatorPipeline.builder()
            .parameter("name", Validators::nameval)
            .parameter("ensure", Validators::string, Validators.values("present", "absent"))
            .parameter("ip", Validators::string, Validators::mandatoryIfNotAbsent, Validators::ipaddr)
            .parameter("host_aliases", Validators::rarray, Validators::strings)
            .parameter("comment", Validators::string)
            .parameter("target", Validators::string, Validators::fullyQualified)
            .parameter("provider", Validators::string)
            .build();
    }

    static ValidatorPipeline exec() {
        return ValidatorPipeline.builder()
            .parameter("command", Validators::nameval, Validators::mandatory)
            .parameter("creates", Validators::rarray, Validators::fullyQualifieds)
            .parameter("cwd", Validators::string, Validators::fullyQualified)
            .parameter("environment", Validators::rarray, Validators::strings)
            .parameter("group", Validators::string)
            .parameter("logoutput", Validators::string, Validators.values("true", "false", "on_failure"))
            .parameter("onlyif", Validators::string)
            .parameter("path", Validators::rarray, Validators::strings)
            .parameter("provider", Validators::string)
            .parameter("refresh", Validators::string)
            .parameter("refreshonly", Validators::string, Validators.values("true", "false"))
            .parameter("returns", Validators::rarray, Validators::integers)
            .parameter("timeout", Validators::integer)
            .parameter("tries", Validators::integer, Validators.inRange(1, 1000))
            .parameter("try_sleep", Validators::integer)
            .parameter("umask", Validators::string)
            .parameter("unless", Validators::string)
            .parameter("user", Validators::string)
            .build();
    }

    static ValidatorPipeline cron() {
        return ValidatorPipeline.builder()
            .parameter("name", Validators::nameval)
            .parameter("ensure", Validators::string, Validators.values("present", "absent"))
            .parameter("command", Validators::string, Validators::mandatoryIfNotAbsent)
            .parameter("environment", Validators::rarray, Validators::strings)
            .parameter("user", Validators::string)
            .parameter("minute", Validators::rarray, Validators::strings)
            .parameter("hour", Validators::rarray, Validators::strings)
            .parameter("monthday", Validators::rarray, Validators::strings)
            .parameter("month", Validators::rarray, Validators::strings)
            .parameter("weekday", Validators::rarray, Validators::strings)
            .parameter("special", Validators::string)
            .parameter("target", Validators::string)
            .build();
    }

    static ValidatorPipeline mount() {
        return ValidatorPipeline.builder()
            .parameter("name", Validators::nameval, Validators::fullyQualified, Validators::noTrailingSlash)
            .parameter("ensure", Validators.defaultValue("present"), Validators::string,
                Validators.values("present", "absent", "defined", "unmounted", "mounted"))
            .parameter("device", Validators::string, Validators::mandatoryIfNotAbsent)
            .parameter("fstype", Validators::string, Validators::mandatoryIfNotAbsent)
            .parameter("options", Validators::string)
            .parameter("dump", Validators::integer, Validators.inRange(0, 2))
            .parameter("pass", Validators::integer)
            .parameter("atboot", Validators::string, Validators.values("true", "false", "yes", "no"))
            .parameter("remounts", Validators::string, Validators.values("true", "false"))
            .parameter("blockdevice", Validators::string)
            .parameter("target", Validators::string, Validators::fullyQualified)
            .build();
    }

    static ValidatorPipeline notifyType() {
        return ValidatorPipeline.builder()
            .parameter("name", Validators::string)
            .parameter("message", Validators::string)
            .parameter("withpath", Validators::string, Validators.values("true", "false"))
            .build();
    }

    static ValidatorPipeline sshAuthorizedKey() {
        return ValidatorPipeline.builder()
            .parameter("name", Validators::nameval)
            .parameter("ensure", Validators::string, Validators.values("present", "absent"))
            .parameter("key", Validators::string, Validators::mandatoryIfNotAbsent)
            .parameter("type", Validators::string, Validators.values(
                "ssh-dss", "ssh-rsa", "ecdsa-sha2-nistp256", "ecdsa-sha2-nistp384", "ecdsa-sha2-nistp521",
                "ssh-ed25519", "dsa", "rsa", "ecdsa", "ed25519"))
            .parameter("user", Validators::string)
            .parameter("target", Validators::string, Validators::fullyQualified)
            .parameter("options", Validators::rarray, Validators::strings)
            .build();
    }
}
